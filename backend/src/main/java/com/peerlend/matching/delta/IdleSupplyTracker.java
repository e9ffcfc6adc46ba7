package com.peerlend.matching.delta;

import com.peerlend.common.RayMath;
import com.peerlend.domain.Market;
import com.peerlend.domain.ReserveConfiguration;
import com.peerlend.matching.event.IdleSupplyUpdatedEvent;
import com.peerlend.matching.ledger.ActionContext;
import com.peerlend.pool.LendingPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Idle supply: P2P supply whose borrowers left while the pool's supply cap was full. It is held by the
 * engine instead of deposited, and is the first liquidity handed to new borrowers or withdrawing suppliers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdleSupplyTracker {

    private final LendingPool lendingPool;

    /**
     * Result of routing an amount to the pool under its supply cap.
     *
     * @param toSupply     part that fits under the cap and goes to the pool
     * @param idleIncrease part held as idle supply
     */
    public record CapSplit(BigDecimal toSupply, BigDecimal idleIncrease) {
    }

    public CapSplit increaseIdle(ActionContext context, BigDecimal amount) {
        if (RayMath.isZero(amount)) {
            return new CapSplit(BigDecimal.ZERO, BigDecimal.ZERO);
        }
        String underlying = context.getUnderlying();
        ReserveConfiguration reserve = lendingPool.reserveConfiguration(underlying);
        BigDecimal supplyCap = reserve.supplyCapInBaseUnits();
        if (supplyCap.signum() == 0) {
            return new CapSplit(amount, BigDecimal.ZERO);
        }
        BigDecimal suppliable = RayMath.zeroFloorSub(supplyCap, lendingPool.totalSupplied(underlying));
        if (amount.compareTo(suppliable) <= 0) {
            return new CapSplit(amount, BigDecimal.ZERO);
        }
        BigDecimal idleIncrease = amount.subtract(suppliable);
        Market market = context.market();
        BigDecimal newIdleSupply = market.getIdleSupply().add(idleIncrease);
        market.setIdleSupply(newIdleSupply);
        log.info("{} supply cap reached; {} kept idle (idle supply now {})", underlying, idleIncrease, newIdleSupply);
        context.record(new IdleSupplyUpdatedEvent(this, underlying, newIdleSupply));
        return new CapSplit(suppliable, idleIncrease);
    }

    /**
     * Consumes idle supply first.
     *
     * @return remaining amount and the amount matched against idle supply
     */
    public AmountSplit decreaseIdle(ActionContext context, BigDecimal amount) {
        Market market = context.market();
        BigDecimal idleSupply = market.getIdleSupply();
        if (RayMath.isZero(amount) || idleSupply.signum() == 0) {
            return AmountSplit.untouched(amount);
        }
        BigDecimal matchedIdle = RayMath.min(idleSupply, amount);
        BigDecimal newIdleSupply = RayMath.zeroFloorSub(idleSupply, matchedIdle);
        market.setIdleSupply(newIdleSupply);
        context.record(new IdleSupplyUpdatedEvent(this, context.getUnderlying(), newIdleSupply));
        return new AmountSplit(amount.subtract(matchedIdle), matchedIdle);
    }
}
