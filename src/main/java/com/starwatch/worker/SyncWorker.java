package com.starwatch.worker;

import com.starwatch.config.SyncProperties;
import com.starwatch.exception.SyncInProgressException;
import com.starwatch.model.SyncOptions;
import com.starwatch.service.SyncPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic sync. Every {@code full-refresh-every}-th run refetches the whole list so that removals and
 * reordering upstream, which the incremental fetch cannot see, reach the cache.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.worker.sync", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(SyncProperties.class)
public class SyncWorker {

    private final SyncPipeline syncPipeline;
    private final SyncProperties properties;

    private final AtomicLong runs = new AtomicLong();

    @Scheduled(fixedDelayString = "${app.worker.sync.interval-ms:3600000}",
        initialDelayString = "${app.worker.sync.initial-delay-ms:60000}")
    public void sync() {
        long run = runs.incrementAndGet();
        boolean fullRefresh = run % properties.fullRefreshEvery() == 0;
        log.debug("Scheduled sync #{} (fullRefresh={})", run, fullRefresh);

        try {
            syncPipeline.run(new SyncOptions(false, false, fullRefresh));
        } catch (SyncInProgressException e) {
            log.info("Skipping scheduled sync, a run is already in progress");
        } catch (RuntimeException e) {
            log.error("Scheduled sync failed", e);
        }
    }
}
