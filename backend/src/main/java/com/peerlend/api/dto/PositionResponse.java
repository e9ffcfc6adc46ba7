package com.peerlend.api.dto;

import java.math.BigDecimal;

/**
 * One user's position on one market. Balances in underlying units at the market's last indexes.
 */
public record PositionResponse(
        String underlying,
        String user,
        BigDecimal supplyBalance,
        BigDecimal scaledSupplyOnPool,
        BigDecimal scaledSupplyInP2P,
        BigDecimal borrowBalance,
        BigDecimal scaledBorrowOnPool,
        BigDecimal scaledBorrowInP2P,
        BigDecimal collateralBalance,
        BigDecimal scaledCollateral,
        boolean collateralMarket,
        boolean borrowMarket
) {}
