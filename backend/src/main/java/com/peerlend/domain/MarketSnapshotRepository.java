package com.peerlend.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for market_snapshots. Written by MarketSnapshotService, read by the query API.
 */
public interface MarketSnapshotRepository extends MongoRepository<MarketSnapshot, String> {

    Optional<MarketSnapshot> findFirstByUnderlyingOrderByCapturedAtDesc(String underlying);

    long deleteByCapturedAtBefore(Instant cutoff);
}
