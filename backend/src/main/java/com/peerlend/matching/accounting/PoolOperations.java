package com.peerlend.matching.accounting;

import java.math.BigDecimal;

/**
 * Pool legs the caller has to execute for an accounted action (underlying units).
 */
public record PoolOperations(BigDecimal toSupply, BigDecimal toRepay, BigDecimal toBorrow, BigDecimal toWithdraw) {

    public static PoolOperations supplyRepay(BigDecimal toSupply, BigDecimal toRepay) {
        return new PoolOperations(toSupply, toRepay, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public static PoolOperations borrowWithdraw(BigDecimal toBorrow, BigDecimal toWithdraw) {
        return new PoolOperations(BigDecimal.ZERO, BigDecimal.ZERO, toBorrow, toWithdraw);
    }
}
