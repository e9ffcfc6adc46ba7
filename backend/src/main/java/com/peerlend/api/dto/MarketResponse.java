package com.peerlend.api.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Committed state of one market. Scaled values keep their units; volumes are in underlying units.
 */
public record MarketResponse(
        String underlying,
        boolean collateral,
        boolean p2pDisabled,
        boolean deprecated,
        int eModeCategoryId,
        List<String> pausedActions,
        BigDecimal idleSupply,
        SideResponse supply,
        SideResponse borrow,
        Instant lastUpdatedAt
) {

    public record SideResponse(
            BigDecimal poolIndex,
            BigDecimal p2pIndex,
            BigDecimal scaledDelta,
            BigDecimal scaledP2PTotal,
            BigDecimal scaledPoolTotal,
            BigDecimal trueP2PVolume,
            int poolUsers,
            int p2pUsers
    ) {}
}
