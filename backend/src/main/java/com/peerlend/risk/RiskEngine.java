package com.peerlend.risk;

import com.peerlend.domain.Indexes;
import com.peerlend.domain.LiquidityData;

import java.math.BigDecimal;

/**
 * Risk/health collaborator: accrual indexes and user liquidity, computed from prices and the ledger.
 */
public interface RiskEngine {

    /**
     * Indexes of the market for the current moment. Must never go below previously returned values.
     */
    Indexes updatedIndexes(String underlying);

    /**
     * Liquidity of {@code user} as if {@code withdrawAmount} of collateral were withdrawn from and
     * {@code borrowAmount} borrowed on {@code underlying}.
     */
    LiquidityData liquidityData(String underlying, String user, BigDecimal withdrawAmount, BigDecimal borrowAmount);
}
