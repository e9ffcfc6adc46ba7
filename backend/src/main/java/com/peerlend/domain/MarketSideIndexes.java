package com.peerlend.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Accrual factors of one market side: the pool's index and the peer-to-peer index.
 */
public record MarketSideIndexes(BigDecimal poolIndex, BigDecimal p2pIndex) {

    public MarketSideIndexes {
        Objects.requireNonNull(poolIndex, "poolIndex must not be null");
        Objects.requireNonNull(p2pIndex, "p2pIndex must not be null");
        if (poolIndex.signum() <= 0 || p2pIndex.signum() <= 0) {
            throw new IllegalArgumentException("Indexes must be positive, got pool=" + poolIndex + " p2p=" + p2pIndex);
        }
    }

    public boolean isNotBelow(MarketSideIndexes previous) {
        return poolIndex.compareTo(previous.poolIndex) >= 0 && p2pIndex.compareTo(previous.p2pIndex) >= 0;
    }
}
