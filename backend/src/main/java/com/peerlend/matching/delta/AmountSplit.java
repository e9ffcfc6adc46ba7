package com.peerlend.matching.delta;

import java.math.BigDecimal;

/**
 * Outcome of absorbing part of an amount: what is left to route elsewhere and what was absorbed.
 */
public record AmountSplit(BigDecimal remaining, BigDecimal absorbed) {

    public static AmountSplit untouched(BigDecimal amount) {
        return new AmountSplit(amount, BigDecimal.ZERO);
    }
}
