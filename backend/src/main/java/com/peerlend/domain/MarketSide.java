package com.peerlend.domain;

/**
 * Side of a market: suppliers lend the underlying, borrowers owe it.
 */
public enum MarketSide {
    SUPPLY,
    BORROW;

    public MarketSide opposite() {
        return this == SUPPLY ? BORROW : SUPPLY;
    }
}
