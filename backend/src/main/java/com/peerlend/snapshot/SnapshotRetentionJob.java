package com.peerlend.snapshot;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
@RequiredArgsConstructor
public class SnapshotRetentionJob {

    private final MarketSnapshotService marketSnapshotService;

    @Scheduled(
            fixedDelayString = "${peerlend.snapshot.purge-interval-ms:3600000}",
            initialDelayString = "${peerlend.snapshot.purge-interval-ms:3600000}")
    public void runScheduled() {
        marketSnapshotService.purgeExpired(Instant.now());
    }
}
