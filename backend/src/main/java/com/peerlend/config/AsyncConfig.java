package com.peerlend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. Actions themselves run on the caller's thread; only read-side work is asynchronous.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String SNAPSHOT_EXECUTOR = "snapshot-executor";

    /** Single thread keeps market_snapshots in commit order. */
    @Bean(name = SNAPSHOT_EXECUTOR)
    public Executor snapshotExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(10_000);
        e.setThreadNamePrefix("snapshot-");
        e.initialize();
        return e;
    }
}
