package com.peerlend.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Market state captured after a committed action, for the read side. Never read back by the engine.
 * Scaled fields keep their units (delta: pool index, total: P2P index); BigDecimal stored as Decimal128.
 */
@Document(collection = "market_snapshots")
@CompoundIndex(name = "underlying_captured", def = "{'underlying': 1, 'capturedAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MarketSnapshot {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String underlying;
    private MarketAction action;
    private BigDecimal supplyScaledDelta;
    private BigDecimal supplyScaledP2PTotal;
    private BigDecimal borrowScaledDelta;
    private BigDecimal borrowScaledP2PTotal;
    private BigDecimal idleSupply;
    private BigDecimal scaledPoolSupplyTotal;
    private BigDecimal scaledPoolBorrowTotal;
    private BigDecimal poolSupplyIndex;
    private BigDecimal p2pSupplyIndex;
    private BigDecimal poolBorrowIndex;
    private BigDecimal p2pBorrowIndex;
    private Instant capturedAt;
}
