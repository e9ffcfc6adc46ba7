package com.peerlend.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Peer-to-peer bookkeeping of one market side.
 * scaledDelta: P2P volume without a real counterpart, backed by the pool (pool-index units).
 * scaledP2PTotal: total promised P2P volume of the side (P2P-index units).
 */
@NoArgsConstructor
@Getter
@Setter
public class MarketSideDelta {

    private BigDecimal scaledDelta = BigDecimal.ZERO;
    private BigDecimal scaledP2PTotal = BigDecimal.ZERO;

    public MarketSideDelta copy() {
        MarketSideDelta copy = new MarketSideDelta();
        copy.scaledDelta = scaledDelta;
        copy.scaledP2PTotal = scaledP2PTotal;
        return copy;
    }
}
