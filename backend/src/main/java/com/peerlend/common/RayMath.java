package com.peerlend.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point arithmetic between integer token amounts and accrual indexes.
 * Amounts and scaled balances are integral BigDecimal values (scale 0, underlying base units);
 * indexes are decimal factors (1.0 at genesis). Every result is rounded back to an integer and
 * the rounding direction is always chosen by the caller:
 * <ul>
 *     <li>{@code mul}/{@code div}: half-up, for bookkeeping that is not owed to anyone;</li>
 *     <li>{@code mulDown}/{@code divDown}: floor, for amounts held (assets);</li>
 *     <li>{@code mulUp}/{@code divUp}: ceiling, for amounts owed (liabilities).</li>
 * </ul>
 */
public final class RayMath {

    /** Scale used for ratios (health factor, close factor). */
    public static final int RATIO_SCALE = 18;

    private RayMath() {}

    public static BigDecimal mul(BigDecimal amount, BigDecimal index) {
        return amount.multiply(index).setScale(0, RoundingMode.HALF_UP);
    }

    public static BigDecimal mulDown(BigDecimal amount, BigDecimal index) {
        return amount.multiply(index).setScale(0, RoundingMode.FLOOR);
    }

    public static BigDecimal mulUp(BigDecimal amount, BigDecimal index) {
        return amount.multiply(index).setScale(0, RoundingMode.CEILING);
    }

    public static BigDecimal div(BigDecimal amount, BigDecimal index) {
        return amount.divide(index, 0, RoundingMode.HALF_UP);
    }

    public static BigDecimal divDown(BigDecimal amount, BigDecimal index) {
        return amount.divide(index, 0, RoundingMode.FLOOR);
    }

    public static BigDecimal divUp(BigDecimal amount, BigDecimal index) {
        return amount.divide(index, 0, RoundingMode.CEILING);
    }

    /**
     * Saturating subtraction: {@code max(a - b, 0)}. The only subtraction used on balances and deltas.
     */
    public static BigDecimal zeroFloorSub(BigDecimal a, BigDecimal b) {
        BigDecimal result = a.subtract(b);
        return result.signum() < 0 ? BigDecimal.ZERO : result;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static boolean isZero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }

    /**
     * Ratio {@code numerator / denominator} with {@link #RATIO_SCALE} digits, rounded down.
     */
    public static BigDecimal ratioDown(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, RATIO_SCALE, RoundingMode.FLOOR);
    }

    /**
     * Whole-token cap expressed in base units: {@code cap * 10^decimals}.
     */
    public static BigDecimal toBaseUnits(BigDecimal wholeTokens, int decimals) {
        return wholeTokens.scaleByPowerOfTen(decimals).setScale(0, RoundingMode.FLOOR);
    }
}
