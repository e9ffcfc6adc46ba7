package com.peerlend.matching.positions;

import java.math.BigDecimal;

/**
 * @param amount           amount actually supplied or withdrawn (withdrawals are capped at the balance)
 * @param collateral       resulting collateral balance (underlying units)
 * @param scaledCollateral resulting collateral balance (pool-index units)
 */
public record CollateralResult(BigDecimal amount, BigDecimal collateral, BigDecimal scaledCollateral) {
}
