package com.peerlend.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Supply and borrow side deltas of one market.
 */
@NoArgsConstructor
@Getter
public class Deltas {

    private MarketSideDelta supply = new MarketSideDelta();
    private MarketSideDelta borrow = new MarketSideDelta();

    public MarketSideDelta of(MarketSide side) {
        return side == MarketSide.SUPPLY ? supply : borrow;
    }

    public Deltas copy() {
        Deltas copy = new Deltas();
        copy.supply = supply.copy();
        copy.borrow = borrow.copy();
        return copy;
    }
}
