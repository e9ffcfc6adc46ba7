package com.peerlend.matching.validation;

import com.peerlend.common.RayMath;
import com.peerlend.domain.LiquidityData;

import java.math.BigDecimal;

/**
 * {@code maxDebt / debt}; a user without debt is infinitely healthy.
 */
public final class HealthFactor {

    /** Stands for an infinite health factor. */
    public static final BigDecimal MAX = new BigDecimal("1E+36");

    private HealthFactor() {}

    public static BigDecimal of(LiquidityData liquidityData) {
        if (RayMath.isZero(liquidityData.debt())) {
            return MAX;
        }
        return RayMath.ratioDown(liquidityData.maxDebt(), liquidityData.debt());
    }
}
