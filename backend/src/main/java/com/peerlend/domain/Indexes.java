package com.peerlend.domain;

import java.math.BigDecimal;

/**
 * Supply and borrow indexes of a market at the current moment (provided by the risk engine).
 */
public record Indexes(MarketSideIndexes supply, MarketSideIndexes borrow) {

    public static Indexes genesis() {
        MarketSideIndexes one = new MarketSideIndexes(BigDecimal.ONE, BigDecimal.ONE);
        return new Indexes(one, one);
    }

    public MarketSideIndexes of(MarketSide side) {
        return side == MarketSide.SUPPLY ? supply : borrow;
    }

    /**
     * True when no index moved backwards compared to {@code previous} (indexes only accrue).
     */
    public boolean isNotBelow(Indexes previous) {
        return supply.isNotBelow(previous.supply) && borrow.isNotBelow(previous.borrow);
    }
}
