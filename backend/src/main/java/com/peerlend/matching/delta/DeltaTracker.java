package com.peerlend.matching.delta;

import com.peerlend.common.RayMath;
import com.peerlend.domain.Deltas;
import com.peerlend.domain.Indexes;
import com.peerlend.domain.Market;
import com.peerlend.domain.MarketSide;
import com.peerlend.domain.MarketSideDelta;
import com.peerlend.domain.MarketSideIndexes;
import com.peerlend.matching.event.DeltaUpdatedEvent;
import com.peerlend.matching.event.P2PTotalsUpdatedEvent;
import com.peerlend.matching.ledger.ActionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Keeps each side's P2P delta and P2P total in line with what actually moved between users and the pool.
 * <p>
 * The delta of a side is P2P volume whose counterpart left; it is parked on the pool instead, so it is
 * stored in pool-index units. Totals are stored in P2P-index units. For every side:
 * {@code scaledP2PTotal * p2pIndex >= scaledDelta * poolIndex}.
 */
@Component
@Slf4j
public class DeltaTracker {

    /**
     * Adds {@code amount} (underlying units) to the side's delta, rounded down and never above the
     * side's P2P volume. Call it after the side's P2P total was reduced. No-op for a zero amount.
     */
    public void increaseDelta(ActionContext context, BigDecimal amount, MarketSide side) {
        if (RayMath.isZero(amount)) {
            return;
        }
        MarketSideDelta delta = context.market().getDeltas().of(side);
        MarketSideIndexes indexes = context.getIndexes().of(side);
        BigDecimal newScaledDelta = RayMath.min(
                delta.getScaledDelta().add(RayMath.divDown(amount, indexes.poolIndex())),
                maxScaledDelta(delta, indexes));
        delta.setScaledDelta(newScaledDelta);
        log.debug("{} {} delta increased by {} to scaled {}", context.getUnderlying(), side, amount, newScaledDelta);
        context.record(new DeltaUpdatedEvent(this, context.getUnderlying(), side, newScaledDelta));
    }

    /**
     * Absorbs up to the side's delta value from {@code amount}. The delta never goes below zero.
     *
     * @return remaining amount and the amount absorbed by the delta (underlying units)
     */
    public AmountSplit decreaseDelta(ActionContext context, BigDecimal amount, MarketSide side) {
        MarketSideDelta delta = context.market().getDeltas().of(side);
        BigDecimal scaledDelta = delta.getScaledDelta();
        if (RayMath.isZero(amount) || scaledDelta.signum() == 0) {
            return AmountSplit.untouched(amount);
        }
        BigDecimal poolIndex = context.getIndexes().of(side).poolIndex();
        BigDecimal absorbed = RayMath.min(RayMath.mulUp(scaledDelta, poolIndex), amount);
        BigDecimal newScaledDelta = RayMath.zeroFloorSub(scaledDelta, RayMath.divDown(absorbed, poolIndex));
        delta.setScaledDelta(newScaledDelta);
        log.debug("{} {} delta absorbed {}, scaled delta now {}", context.getUnderlying(), side, absorbed, newScaledDelta);
        context.record(new DeltaUpdatedEvent(this, context.getUnderlying(), side, newScaledDelta));
        return new AmountSplit(amount.subtract(absorbed), absorbed);
    }

    /**
     * Registers new P2P volume. {@code amount} is everything the acting user gets matched on {@code side};
     * {@code promoted} is the part coming from counterparts newly promoted on the opposite side.
     *
     * @return the acting user's P2P balance increase (P2P-index units)
     */
    public BigDecimal increaseP2P(ActionContext context, BigDecimal promoted, BigDecimal amount, MarketSide side) {
        if (RayMath.isZero(amount)) {
            return BigDecimal.ZERO;
        }
        Indexes indexes = context.getIndexes();
        Deltas deltas = context.market().getDeltas();
        MarketSideDelta acting = deltas.of(side);
        MarketSideDelta counter = deltas.of(side.opposite());

        BigDecimal amountP2P = RayMath.div(amount, indexes.of(side).p2pIndex());
        acting.setScaledP2PTotal(acting.getScaledP2PTotal().add(amountP2P));
        counter.setScaledP2PTotal(counter.getScaledP2PTotal()
                .add(RayMath.div(promoted, indexes.of(side.opposite()).p2pIndex())));
        recordTotals(context);
        return amountP2P;
    }

    /**
     * Removes P2P volume. {@code amount} is the net P2P reduction on the acting {@code side};
     * {@code demoted} is what counterparts on the opposite side were pushed back to the pool with.
     */
    public void decreaseP2P(ActionContext context, BigDecimal demoted, BigDecimal amount, MarketSide side) {
        if (RayMath.isZero(amount)) {
            return;
        }
        Indexes indexes = context.getIndexes();
        Deltas deltas = context.market().getDeltas();
        MarketSideDelta acting = deltas.of(side);
        MarketSideDelta counter = deltas.of(side.opposite());

        acting.setScaledP2PTotal(RayMath.zeroFloorSub(acting.getScaledP2PTotal(),
                RayMath.div(amount, indexes.of(side).p2pIndex())));
        counter.setScaledP2PTotal(RayMath.zeroFloorSub(counter.getScaledP2PTotal(),
                RayMath.div(demoted, indexes.of(side.opposite()).p2pIndex())));
        capDelta(context, side);
        capDelta(context, side.opposite());
        recordTotals(context);
    }

    /**
     * Uses a repayment to pay down the P2P fee first: borrow-side P2P volume with no supply-side counterpart,
     * accrued because the two sides grow at different P2P rates.
     *
     * @return the part of {@code amount} left after the fee
     */
    public BigDecimal repayFee(ActionContext context, BigDecimal amount) {
        if (RayMath.isZero(amount)) {
            return amount;
        }
        Indexes indexes = context.getIndexes();
        Deltas deltas = context.market().getDeltas();
        BigDecimal scaledTotalBorrowP2P = deltas.getBorrow().getScaledP2PTotal();
        // The borrow delta is zero here: the repayment went through decreaseDelta first.
        BigDecimal matchedSupply = RayMath.zeroFloorSub(
                trueP2P(context.market(), indexes, MarketSide.SUPPLY), context.market().getIdleSupply());
        BigDecimal fee = RayMath.zeroFloorSub(
                RayMath.mul(scaledTotalBorrowP2P, indexes.borrow().p2pIndex()), matchedSupply);
        if (fee.signum() == 0) {
            return amount;
        }
        BigDecimal feeToRepay = RayMath.min(fee, amount);
        deltas.getBorrow().setScaledP2PTotal(RayMath.zeroFloorSub(scaledTotalBorrowP2P,
                RayMath.divDown(feeToRepay, indexes.borrow().p2pIndex())));
        log.debug("{} P2P fee repaid: {}", context.getUnderlying(), feeToRepay);
        capDelta(context, MarketSide.BORROW);
        recordTotals(context);
        return amount.subtract(feeToRepay);
    }

    /**
     * P2P volume of a side that has a real counterpart: total minus delta, in underlying units.
     */
    public static BigDecimal trueP2P(Market market, Indexes indexes, MarketSide side) {
        MarketSideDelta delta = market.getDeltas().of(side);
        MarketSideIndexes sideIndexes = indexes.of(side);
        return RayMath.zeroFloorSub(
                RayMath.mul(delta.getScaledP2PTotal(), sideIndexes.p2pIndex()),
                RayMath.mul(delta.getScaledDelta(), sideIndexes.poolIndex()));
    }

    /**
     * Largest scaled delta whose value stays within the side's P2P volume once both are rounded half-up.
     */
    static BigDecimal maxScaledDelta(MarketSideDelta delta, MarketSideIndexes indexes) {
        return RayMath.divDown(RayMath.mul(delta.getScaledP2PTotal(), indexes.p2pIndex()), indexes.poolIndex());
    }

    /**
     * Rounding dust: a shrinking P2P total can leave the delta one unit above it.
     */
    private void capDelta(ActionContext context, MarketSide side) {
        MarketSideDelta delta = context.market().getDeltas().of(side);
        BigDecimal max = maxScaledDelta(delta, context.getIndexes().of(side));
        if (delta.getScaledDelta().compareTo(max) <= 0) {
            return;
        }
        log.debug("{} {} delta capped from {} to scaled {}", context.getUnderlying(), side, delta.getScaledDelta(), max);
        delta.setScaledDelta(max);
        context.record(new DeltaUpdatedEvent(this, context.getUnderlying(), side, max));
    }

    private void recordTotals(ActionContext context) {
        Deltas deltas = context.market().getDeltas();
        context.record(new P2PTotalsUpdatedEvent(this, context.getUnderlying(),
                deltas.getSupply().getScaledP2PTotal(), deltas.getBorrow().getScaledP2PTotal()));
    }
}
