package com.peerlend.domain;

import com.peerlend.common.RayMath;

import java.math.BigDecimal;

/**
 * Handle on everything an action may mutate for one underlying: market configuration/deltas and user balances.
 * Balances below are valued at the market's last applied indexes; supply rounds down, debt rounds up.
 */
public record MarketState(Market market, MarketBalances balances) {

    public BigDecimal supplyBalance(String user) {
        MarketSideIndexes indexes = market.getIndexes().supply();
        return RayMath.mulDown(balances.scaledPoolBalance(MarketSide.SUPPLY, user), indexes.poolIndex())
                .add(RayMath.mulDown(balances.scaledP2PBalance(MarketSide.SUPPLY, user), indexes.p2pIndex()));
    }

    public BigDecimal borrowBalance(String user) {
        MarketSideIndexes indexes = market.getIndexes().borrow();
        return RayMath.mulUp(balances.scaledPoolBalance(MarketSide.BORROW, user), indexes.poolIndex())
                .add(RayMath.mulUp(balances.scaledP2PBalance(MarketSide.BORROW, user), indexes.p2pIndex()));
    }

    public BigDecimal collateralBalance(String user) {
        return RayMath.mulDown(balances.scaledCollateral(user), market.getIndexes().supply().poolIndex());
    }

    public MarketState copy() {
        return new MarketState(market.copy(), balances.copy());
    }
}
