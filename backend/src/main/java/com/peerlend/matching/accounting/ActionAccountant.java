package com.peerlend.matching.accounting;

import com.peerlend.common.RayMath;
import com.peerlend.domain.MarketBalances;
import com.peerlend.domain.MarketSide;
import com.peerlend.domain.MarketSideIndexes;
import com.peerlend.matching.delta.AmountSplit;
import com.peerlend.matching.delta.DeltaTracker;
import com.peerlend.matching.delta.IdleSupplyTracker;
import com.peerlend.matching.engine.MatchingEngine;
import com.peerlend.matching.engine.MatchingStrategy;
import com.peerlend.matching.engine.PromotionResult;
import com.peerlend.matching.ledger.ActionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * State transitions of the liquidity actions on an open unit of work. Inputs are validated upstream;
 * amounts are in underlying units, balances in scaled units.
 * <p>
 * Adding liquidity first takes over the opposite side's delta, then promotes opposite pool users, and sends
 * the rest to the pool. Removing liquidity first uses the user's own pool balance, then their P2P balance;
 * the P2P part is replaced by idle supply, the side's own delta, and promoted same-side pool users, and
 * what is still missing breaks P2P matches: opposite counterparts are demoted or covered by a new delta.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ActionAccountant {

    private final DeltaTracker deltaTracker;
    private final IdleSupplyTracker idleSupplyTracker;
    private final MatchingEngine matchingEngine;

    public AccountingResult accountSupply(ActionContext context, BigDecimal amount, String onBehalf, int maxIterations) {
        MarketBalances balances = context.balances();
        MarketSideIndexes indexes = context.getIndexes().supply();
        BigDecimal onPool = balances.scaledPoolBalance(MarketSide.SUPPLY, onBehalf);
        BigDecimal inP2P = balances.scaledP2PBalance(MarketSide.SUPPLY, onBehalf);

        AmountSplit fromDelta = deltaTracker.decreaseDelta(context, amount, MarketSide.BORROW);
        PromotionResult promotion = matchingEngine.promoteRoutine(context, fromDelta.remaining(), maxIterations,
                MatchingStrategy.PROMOTE_BORROWERS);
        BigDecimal toRepay = fromDelta.absorbed().add(promotion.promoted());
        inP2P = inP2P.add(deltaTracker.increaseP2P(context, promotion.promoted(), toRepay, MarketSide.SUPPLY));

        BigDecimal toSupply = promotion.remaining();
        if (toSupply.signum() > 0) {
            onPool = onPool.add(RayMath.divDown(toSupply, indexes.poolIndex()));
        }
        updateUser(context, MarketSide.SUPPLY, onBehalf, onPool, inP2P);
        return new AccountingResult(toSupply, toRepay, PoolOperations.supplyRepay(toSupply, toRepay), onPool, inP2P);
    }

    public AccountingResult accountBorrow(ActionContext context, BigDecimal amount, String borrower, int maxIterations) {
        MarketBalances balances = context.balances();
        MarketSideIndexes indexes = context.getIndexes().borrow();
        BigDecimal onPool = balances.scaledPoolBalance(MarketSide.BORROW, borrower);
        BigDecimal inP2P = balances.scaledP2PBalance(MarketSide.BORROW, borrower);

        AmountSplit fromIdle = idleSupplyTracker.decreaseIdle(context, amount);
        AmountSplit fromDelta = deltaTracker.decreaseDelta(context, fromIdle.remaining(), MarketSide.SUPPLY);
        PromotionResult promotion = matchingEngine.promoteRoutine(context, fromDelta.remaining(), maxIterations,
                MatchingStrategy.PROMOTE_SUPPLIERS);
        BigDecimal toWithdraw = fromDelta.absorbed().add(promotion.promoted());
        BigDecimal matched = toWithdraw.add(fromIdle.absorbed());
        inP2P = inP2P.add(deltaTracker.increaseP2P(context, promotion.promoted(), matched, MarketSide.BORROW));

        BigDecimal toBorrow = promotion.remaining();
        if (toBorrow.signum() > 0) {
            onPool = onPool.add(RayMath.divUp(toBorrow, indexes.poolIndex()));
        }
        updateUser(context, MarketSide.BORROW, borrower, onPool, inP2P);
        context.getUserMarkets().getBorrows().add(context.getUnderlying());
        return new AccountingResult(toBorrow, matched, PoolOperations.borrowWithdraw(toBorrow, toWithdraw), onPool, inP2P);
    }

    public AccountingResult accountRepay(ActionContext context, BigDecimal amount, String onBehalf, int maxIterations) {
        MarketBalances balances = context.balances();
        MarketSideIndexes indexes = context.getIndexes().borrow();
        BigDecimal onPool = balances.scaledPoolBalance(MarketSide.BORROW, onBehalf);
        BigDecimal inP2P = balances.scaledP2PBalance(MarketSide.BORROW, onBehalf);

        BigDecimal fromPool = BigDecimal.ZERO;
        if (onPool.signum() > 0) {
            fromPool = RayMath.min(RayMath.mulUp(onPool, indexes.poolIndex()), amount);
            onPool = RayMath.zeroFloorSub(onPool, RayMath.divUp(fromPool, indexes.poolIndex()));
        }
        // Debt is valued rounding up, the same way borrowBalance caps the repaid amount.
        BigDecimal remaining = RayMath.min(amount.subtract(fromPool), RayMath.mulUp(inP2P, indexes.p2pIndex()));
        inP2P = RayMath.zeroFloorSub(inP2P, RayMath.divUp(remaining, indexes.p2pIndex()));
        updateUser(context, MarketSide.BORROW, onBehalf, onPool, inP2P);
        if (onPool.signum() == 0 && inP2P.signum() == 0) {
            context.getUserMarkets().getBorrows().remove(context.getUnderlying());
        }
        if (remaining.signum() == 0) {
            return new AccountingResult(fromPool, BigDecimal.ZERO, PoolOperations.supplyRepay(BigDecimal.ZERO, fromPool),
                    onPool, inP2P);
        }

        AmountSplit fromDelta = deltaTracker.decreaseDelta(context, remaining, MarketSide.BORROW);
        BigDecimal afterFee = deltaTracker.repayFee(context, fromDelta.remaining());
        PromotionResult promotion = matchingEngine.promoteRoutine(context, afterFee, maxIterations,
                MatchingStrategy.PROMOTE_BORROWERS);
        BigDecimal toRepay = fromPool.add(fromDelta.absorbed()).add(promotion.promoted());

        // Breaking repay: P2P suppliers lose their borrower for the amount left.
        BigDecimal unmatched = promotion.remaining();
        IdleSupplyTracker.CapSplit capSplit = idleSupplyTracker.increaseIdle(context, unmatched);
        BigDecimal toSupply = capSplit.toSupply();
        BigDecimal demoted = matchingEngine.demoteSuppliers(context, toSupply, promotion.iterationsLeft()).processed();
        deltaTracker.decreaseP2P(context, demoted, fromDelta.absorbed().add(unmatched), MarketSide.BORROW);
        deltaTracker.increaseDelta(context, toSupply.subtract(demoted), MarketSide.SUPPLY);
        if (unmatched.signum() > 0) {
            log.debug("{} breaking repay: {} unmatched, {} demoted, {} idle", context.getUnderlying(), unmatched,
                    demoted, capSplit.idleIncrease());
        }
        return new AccountingResult(fromPool, remaining, PoolOperations.supplyRepay(toSupply, toRepay), onPool, inP2P);
    }

    public AccountingResult accountWithdraw(ActionContext context, BigDecimal amount, String supplier, int maxIterations) {
        MarketBalances balances = context.balances();
        MarketSideIndexes indexes = context.getIndexes().supply();
        BigDecimal onPool = balances.scaledPoolBalance(MarketSide.SUPPLY, supplier);
        BigDecimal inP2P = balances.scaledP2PBalance(MarketSide.SUPPLY, supplier);

        BigDecimal fromPool = BigDecimal.ZERO;
        if (onPool.signum() > 0) {
            fromPool = RayMath.min(RayMath.mulDown(onPool, indexes.poolIndex()), amount);
            onPool = RayMath.zeroFloorSub(onPool, RayMath.divUp(fromPool, indexes.poolIndex()));
        }
        // Supply is valued rounding down, the same way supplyBalance caps the withdrawn amount.
        BigDecimal remaining = RayMath.min(amount.subtract(fromPool), RayMath.mulDown(inP2P, indexes.p2pIndex()));
        inP2P = RayMath.zeroFloorSub(inP2P, RayMath.divUp(remaining, indexes.p2pIndex()));
        updateUser(context, MarketSide.SUPPLY, supplier, onPool, inP2P);
        if (remaining.signum() == 0) {
            return new AccountingResult(fromPool, BigDecimal.ZERO, PoolOperations.borrowWithdraw(BigDecimal.ZERO, fromPool),
                    onPool, inP2P);
        }

        AmountSplit fromIdle = idleSupplyTracker.decreaseIdle(context, remaining);
        AmountSplit fromDelta = deltaTracker.decreaseDelta(context, fromIdle.remaining(), MarketSide.SUPPLY);
        PromotionResult promotion = matchingEngine.promoteRoutine(context, fromDelta.remaining(), maxIterations,
                MatchingStrategy.PROMOTE_SUPPLIERS);
        BigDecimal toWithdraw = fromPool.add(fromDelta.absorbed()).add(promotion.promoted());

        // Breaking withdraw: P2P borrowers lose their supplier for the amount left, which is borrowed on the pool.
        BigDecimal toBorrow = promotion.remaining();
        BigDecimal demoted = matchingEngine.demoteBorrowers(context, toBorrow, promotion.iterationsLeft()).processed();
        deltaTracker.decreaseP2P(context, demoted,
                fromIdle.absorbed().add(fromDelta.absorbed()).add(toBorrow), MarketSide.SUPPLY);
        deltaTracker.increaseDelta(context, toBorrow.subtract(demoted), MarketSide.BORROW);
        if (toBorrow.signum() > 0) {
            log.debug("{} breaking withdraw: {} unmatched, {} demoted", context.getUnderlying(), toBorrow, demoted);
        }
        return new AccountingResult(fromPool, remaining, PoolOperations.borrowWithdraw(toBorrow, toWithdraw), onPool, inP2P);
    }

    /**
     * @return resulting scaled collateral of {@code onBehalf}
     */
    public BigDecimal accountSupplyCollateral(ActionContext context, BigDecimal amount, String onBehalf) {
        MarketBalances balances = context.balances();
        BigDecimal collateral = balances.scaledCollateral(onBehalf)
                .add(RayMath.divDown(amount, context.getIndexes().supply().poolIndex()));
        balances.setScaledCollateral(onBehalf, collateral);
        if (collateral.signum() > 0) {
            context.getUserMarkets().getCollaterals().add(context.getUnderlying());
        }
        return collateral;
    }

    /**
     * @return resulting scaled collateral of {@code onBehalf}
     */
    public BigDecimal accountWithdrawCollateral(ActionContext context, BigDecimal amount, String onBehalf) {
        MarketBalances balances = context.balances();
        BigDecimal collateral = RayMath.zeroFloorSub(balances.scaledCollateral(onBehalf),
                RayMath.divUp(amount, context.getIndexes().supply().poolIndex()));
        balances.setScaledCollateral(onBehalf, collateral);
        if (collateral.signum() == 0) {
            context.getUserMarkets().getCollaterals().remove(context.getUnderlying());
        }
        return collateral;
    }

    private static void updateUser(ActionContext context, MarketSide side, String user, BigDecimal onPool, BigDecimal inP2P) {
        MarketBalances balances = context.balances();
        balances.pool(side).update(user, onPool);
        balances.p2p(side).update(user, inP2P);
    }
}
