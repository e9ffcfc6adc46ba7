package com.peerlend.snapshot;

import com.peerlend.config.AsyncConfig;
import com.peerlend.domain.Market;
import com.peerlend.domain.MarketSide;
import com.peerlend.domain.MarketSnapshot;
import com.peerlend.domain.MarketSnapshotRepository;
import com.peerlend.domain.MarketState;
import com.peerlend.matching.event.ActionCommittedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Read side of the ledger: one market_snapshots document per committed action.
 * Persistence failures are logged; they never affect the action, which is already committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketSnapshotService {

    private final MarketSnapshotRepository marketSnapshotRepository;
    private final SnapshotProperties properties;

    @Async(AsyncConfig.SNAPSHOT_EXECUTOR)
    @EventListener
    public void onActionCommitted(ActionCommittedEvent event) {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            marketSnapshotRepository.save(toSnapshot(event));
        } catch (RuntimeException e) {
            log.error("Failed to persist snapshot of {} after {}: {}", event.getUnderlying(), event.getAction(),
                    e.getMessage(), e);
        }
    }

    public Optional<MarketSnapshot> latest(String underlying) {
        return marketSnapshotRepository.findFirstByUnderlyingOrderByCapturedAtDesc(underlying);
    }

    /**
     * Deletes snapshots older than the retention window.
     *
     * @return number of deleted snapshots, 0 when retention is disabled
     */
    public long purgeExpired(Instant now) {
        if (properties.getRetentionDays() <= 0) {
            return 0;
        }
        Instant cutoff = now.minus(Duration.ofDays(properties.getRetentionDays()));
        long deleted = marketSnapshotRepository.deleteByCapturedAtBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} market snapshots captured before {}", deleted, cutoff);
        }
        return deleted;
    }

    static MarketSnapshot toSnapshot(ActionCommittedEvent event) {
        MarketState state = event.getCommittedState();
        Market market = state.market();
        MarketSnapshot snapshot = new MarketSnapshot();
        snapshot.setUnderlying(event.getUnderlying());
        snapshot.setAction(event.getAction());
        snapshot.setSupplyScaledDelta(market.getDeltas().getSupply().getScaledDelta());
        snapshot.setSupplyScaledP2PTotal(market.getDeltas().getSupply().getScaledP2PTotal());
        snapshot.setBorrowScaledDelta(market.getDeltas().getBorrow().getScaledDelta());
        snapshot.setBorrowScaledP2PTotal(market.getDeltas().getBorrow().getScaledP2PTotal());
        snapshot.setIdleSupply(market.getIdleSupply());
        snapshot.setScaledPoolSupplyTotal(state.balances().pool(MarketSide.SUPPLY).total());
        snapshot.setScaledPoolBorrowTotal(state.balances().pool(MarketSide.BORROW).total());
        snapshot.setPoolSupplyIndex(market.getIndexes().supply().poolIndex());
        snapshot.setP2pSupplyIndex(market.getIndexes().supply().p2pIndex());
        snapshot.setPoolBorrowIndex(market.getIndexes().borrow().poolIndex());
        snapshot.setP2pBorrowIndex(market.getIndexes().borrow().p2pIndex());
        snapshot.setCapturedAt(Instant.ofEpochMilli(event.getTimestamp()));
        return snapshot;
    }
}
