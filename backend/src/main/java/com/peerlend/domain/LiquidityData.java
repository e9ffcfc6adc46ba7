package com.peerlend.domain;

import java.math.BigDecimal;

/**
 * Risk snapshot of a user, in the oracle's base currency.
 *
 * @param borrowable max debt allowed by loan-to-value
 * @param maxDebt    debt at which the user becomes liquidatable (liquidation threshold)
 * @param debt       current debt, including any hypothetical borrow being authorized
 */
public record LiquidityData(BigDecimal borrowable, BigDecimal maxDebt, BigDecimal debt) {
}
