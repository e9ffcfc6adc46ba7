package com.peerlend.api.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record SnapshotResponse(
        String underlying,
        String action,
        Instant capturedAt,
        BigDecimal supplyScaledDelta,
        BigDecimal supplyScaledP2PTotal,
        BigDecimal borrowScaledDelta,
        BigDecimal borrowScaledP2PTotal,
        BigDecimal idleSupply,
        BigDecimal scaledPoolSupplyTotal,
        BigDecimal scaledPoolBorrowTotal,
        BigDecimal poolSupplyIndex,
        BigDecimal p2pSupplyIndex,
        BigDecimal poolBorrowIndex,
        BigDecimal p2pBorrowIndex
) {}
