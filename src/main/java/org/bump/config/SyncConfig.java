package org.bump.config;

import org.bump.sync.ExecutorTickScheduler;
import org.bump.sync.SyncPoller;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class SyncConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService syncTickExecutor(@Value("${bump.sync.pool-size:2}") int poolSize) {
        return Executors.newScheduledThreadPool(poolSize);
    }

    // Les fetchs tournent hors du thread des ticks pour ne pas le bloquer
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService syncFetchExecutor(@Value("${bump.sync.pool-size:2}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize);
    }

    @Bean
    public SyncPoller syncPoller(@Qualifier("syncTickExecutor") ScheduledExecutorService syncTickExecutor,
                                 @Qualifier("syncFetchExecutor") ExecutorService syncFetchExecutor,
                                 Clock clock,
                                 @Value("${bump.sync.default-interval-ms:5000}") long defaultIntervalMs,
                                 @Value("${bump.sync.min-interval-ms:250}") long minIntervalMs,
                                 @Value("${bump.sync.lease-ticks:3}") int leaseTicks,
                                 @Value("${bump.sync.max-per-owner:10}") int maxPerOwner) {
        return new SyncPoller(new ExecutorTickScheduler(syncTickExecutor), syncFetchExecutor, clock,
                defaultIntervalMs, minIntervalMs, leaseTicks, maxPerOwner);
    }
}
