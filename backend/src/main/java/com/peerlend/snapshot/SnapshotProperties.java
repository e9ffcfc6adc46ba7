package com.peerlend.snapshot;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "peerlend.snapshot")
@NoArgsConstructor
@Getter
@Setter
public class SnapshotProperties {

    /** Persist a market snapshot after every committed action. */
    private boolean enabled = true;

    /** Snapshots older than this are purged by the retention job. 0 keeps everything. */
    private int retentionDays = 30;
}
