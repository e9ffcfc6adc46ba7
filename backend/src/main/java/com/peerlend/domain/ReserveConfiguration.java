package com.peerlend.domain;

import com.peerlend.common.RayMath;

import java.math.BigDecimal;

/**
 * Configuration of the external pool's reserve for one underlying.
 * Caps are in whole tokens (0 = no cap), as the pool stores them.
 */
public record ReserveConfiguration(
        BigDecimal supplyCap,
        BigDecimal borrowCap,
        int decimals,
        boolean borrowingEnabled,
        int eModeCategoryId
) {

    public BigDecimal supplyCapInBaseUnits() {
        return RayMath.toBaseUnits(supplyCap, decimals);
    }

    public BigDecimal borrowCapInBaseUnits() {
        return RayMath.toBaseUnits(borrowCap, decimals);
    }

    public BigDecimal capInBaseUnits(MarketSide side) {
        return side == MarketSide.SUPPLY ? supplyCapInBaseUnits() : borrowCapInBaseUnits();
    }
}
