package com.iptbrowser.feedsync.scheduler;

import com.iptbrowser.feedsync.config.FeedSyncProperties;
import com.iptbrowser.feedsync.model.RefreshMode;
import com.iptbrowser.feedsync.model.RefreshResult;
import com.iptbrowser.feedsync.service.RefreshOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps the cache warm in the background.
 *
 * Default schedule: an incremental refresh every 30 minutes for the default
 * categories. Override with REFRESH_CRON or feed-sync.scheduling.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RefreshScheduler {

    private final RefreshOrchestrator orchestrator;
    private final FeedSyncProperties properties;

    /**
     * Optionally run a full refresh once the application is up (RUN_ON_STARTUP=true).
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!properties.getScheduling().isRunOnStartup()) {
            log.info("Feed sync ready. Scheduled refresh: {}", properties.getScheduling().getCron());
            return;
        }
        log.info("RUN_ON_STARTUP=true, running full refresh");
        RefreshResult result = orchestrator.refresh(RefreshMode.FULL, null, null, false);
        log.info("Startup refresh done: {} torrents cached", result.summary().totalTorrents());
    }

    @Scheduled(cron = "${feed-sync.scheduling.cron:0 */30 * * * *}")
    public void scheduledRefresh() {
        if (!properties.getScheduling().isEnabled()) return;

        log.info("Scheduled incremental refresh triggered");
        RefreshResult result = orchestrator.refresh(RefreshMode.INCREMENTAL, null, null, false);
        log.info("Scheduled refresh done: {} new, {} total",
                result.summary().fetchedNew(), result.summary().totalTorrents());
    }
}
