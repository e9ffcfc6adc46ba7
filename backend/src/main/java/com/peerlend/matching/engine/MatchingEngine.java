package com.peerlend.matching.engine;

import com.peerlend.common.RayMath;
import com.peerlend.domain.MarketBalances;
import com.peerlend.domain.MarketSide;
import com.peerlend.domain.MarketSideIndexes;
import com.peerlend.domain.MatchingQueue;
import com.peerlend.matching.event.PositionUpdatedEvent;
import com.peerlend.matching.ledger.ActionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Moves volume between pool-only and P2P status by walking a market's queues, one counterpart per
 * iteration. The iteration budget is the only bound on the cost of a walk; whatever it leaves unmatched
 * is the caller's to route to the pool and record as delta.
 */
@Component
@Slf4j
public class MatchingEngine {

    /**
     * Promotes pool users of the strategy's side for up to {@code amount}. P2P-disabled markets and zero
     * amounts fall back to the pool entirely without consuming iterations.
     */
    public PromotionResult promoteRoutine(ActionContext context, BigDecimal amount, int maxIterations,
                                          MatchingStrategy strategy) {
        if (RayMath.isZero(amount) || context.market().isP2pDisabled()) {
            return new PromotionResult(BigDecimal.ZERO, amount, maxIterations);
        }
        MatchingOutcome outcome = switch (strategy) {
            case PROMOTE_SUPPLIERS -> promoteSuppliers(context, amount, maxIterations);
            case PROMOTE_BORROWERS -> promoteBorrowers(context, amount, maxIterations);
        };
        return new PromotionResult(outcome.processed(), amount.subtract(outcome.processed()),
                Math.max(maxIterations - outcome.iterations(), 0));
    }

    public MatchingOutcome promoteSuppliers(ActionContext context, BigDecimal amount, int maxIterations) {
        return walk(context, MarketSide.SUPPLY, amount, maxIterations, false);
    }

    public MatchingOutcome promoteBorrowers(ActionContext context, BigDecimal amount, int maxIterations) {
        return walk(context, MarketSide.BORROW, amount, maxIterations, false);
    }

    public MatchingOutcome demoteSuppliers(ActionContext context, BigDecimal amount, int maxIterations) {
        return walk(context, MarketSide.SUPPLY, amount, maxIterations, true);
    }

    public MatchingOutcome demoteBorrowers(ActionContext context, BigDecimal amount, int maxIterations) {
        return walk(context, MarketSide.BORROW, amount, maxIterations, true);
    }

    private MatchingOutcome walk(ActionContext context, MarketSide side, BigDecimal amount, int maxIterations,
                                 boolean demoting) {
        if (maxIterations <= 0 || RayMath.isZero(amount)) {
            return MatchingOutcome.none();
        }
        MarketBalances balances = context.balances();
        MatchingQueue poolQueue = balances.pool(side);
        MatchingQueue p2pQueue = balances.p2p(side);
        MatchingQueue workingQueue = demoting ? p2pQueue : poolQueue;
        MarketSideIndexes indexes = context.getIndexes().of(side);
        BigDecimal workingIndex = demoting ? indexes.p2pIndex() : indexes.poolIndex();

        BigDecimal remaining = amount;
        int iterations = 0;
        for (; iterations < maxIterations && remaining.signum() > 0; iterations++) {
            String user = workingQueue.getMatch(RayMath.div(remaining, workingIndex));
            if (user == null) {
                break;
            }
            BigDecimal onPool = poolQueue.valueOf(user);
            BigDecimal inP2P = p2pQueue.valueOf(user);
            BigDecimal toProcess;
            if (demoting) {
                toProcess = RayMath.min(RayMath.mul(inP2P, indexes.p2pIndex()), remaining);
                onPool = onPool.add(RayMath.div(toProcess, indexes.poolIndex()));
                inP2P = RayMath.zeroFloorSub(inP2P, RayMath.div(toProcess, indexes.p2pIndex()));
            } else {
                toProcess = RayMath.min(RayMath.mul(onPool, indexes.poolIndex()), remaining);
                onPool = RayMath.zeroFloorSub(onPool, RayMath.div(toProcess, indexes.poolIndex()));
                inP2P = inP2P.add(RayMath.div(toProcess, indexes.p2pIndex()));
            }
            remaining = remaining.subtract(toProcess);
            poolQueue.update(user, onPool);
            p2pQueue.update(user, inP2P);
            log.debug("{} {} {} {}: {} moved, pool {} / p2p {}", context.getUnderlying(),
                    demoting ? "demoted" : "promoted", side, user, toProcess, onPool, inP2P);
            context.record(new PositionUpdatedEvent(this, side, user, context.getUnderlying(), onPool, inP2P));
        }
        return new MatchingOutcome(amount.subtract(remaining), iterations);
    }
}
