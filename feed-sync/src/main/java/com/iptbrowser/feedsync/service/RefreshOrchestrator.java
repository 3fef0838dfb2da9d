package com.iptbrowser.feedsync.service;

import com.iptbrowser.feedsync.config.FeedSyncProperties;
import com.iptbrowser.feedsync.fetch.ConcurrentPaginator;
import com.iptbrowser.feedsync.fetch.FetchBatch;
import com.iptbrowser.feedsync.fetch.IncrementalWalker;
import com.iptbrowser.feedsync.model.RefreshMode;
import com.iptbrowser.feedsync.model.RefreshResult;
import com.iptbrowser.feedsync.store.CacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one refresh cycle in the requested mode.
 *
 *  - cache-only:  serve the cache, no network access
 *  - incremental: per category, walk from the newest page down to the cached watermark
 *  - full:        per category, re-fetch the whole day window, unless the cache is fresh
 *
 * Categories are processed one after another. A category whose first page cannot
 * be fetched keeps its cached records; when no category answers at all the
 * cycle returns the cache as it was.
 */
@Service
@Slf4j
public class RefreshOrchestrator {

    private final ConcurrentPaginator paginator;
    private final IncrementalWalker walker;
    private final CacheStore cacheStore;
    private final FeedSyncProperties properties;
    private final Clock clock;

    /** One cycle at a time, so scheduled and on-demand refreshes never interleave. */
    private final ReentrantLock cycleLock = new ReentrantLock();

    public RefreshOrchestrator(ConcurrentPaginator paginator, IncrementalWalker walker, CacheStore cacheStore,
                               FeedSyncProperties properties, Clock clock) {
        this.paginator = paginator;
        this.walker = walker;
        this.cacheStore = cacheStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param categories categories to refresh, null or empty for the configured defaults
     * @param days       full-mode window in days, null for the cache's default window
     * @param force      run a full fetch even when the cache is fresh; upgrades incremental to full
     */
    public RefreshResult refresh(RefreshMode mode, List<String> categories, Integer days, boolean force) {
        List<String> targets = categories == null || categories.isEmpty()
                ? properties.getSource().getDefaultCategories()
                : categories;

        if (mode == RefreshMode.CACHE_ONLY) {
            log.info("Using cached data (cache-only mode)");
            return cached(0);
        }

        cycleLock.lock();
        try {
            if (mode == RefreshMode.INCREMENTAL && !force) {
                return incremental(targets);
            }
            int window = days != null && days > 0 ? days : cacheStore.defaultWindowDays();
            return full(targets, window, force);
        } catch (RuntimeException e) {
            log.error("Refresh ({}) failed, serving cached data: {}", mode.value(), e.getMessage(), e);
            return cached(0);
        } finally {
            cycleLock.unlock();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RefreshResult incremental(List<String> categories) {
        log.info("Fetching incremental updates for {}", categories);
        int added = 0;
        int answered = 0;

        for (String category : categories) {
            LocalDateTime watermark = cacheStore.newestTimestamp(category).orElse(null);
            FetchBatch batch = walker.fetchSince(category, watermark);
            if (batch.sourceUnavailable()) {
                log.warn("{}: source unavailable, keeping cached records ({})", category, batch.failures());
                continue;
            }
            answered++;
            added += cacheStore.ingestIncremental(category, batch.records());
        }

        if (answered == 0) {
            log.warn("No category could be fetched, serving last known cache");
            return cached(0);
        }
        log.info("Incremental refresh complete: {} new torrents", added);
        return cached(added);
    }

    private RefreshResult full(List<String> categories, int days, boolean force) {
        if (!force && cacheStore.isFresh(properties.getCache().getMaxAge())) {
            log.info("Cache is fresh, skipping full fetch");
            return cached(0);
        }

        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(days);
        log.info("Fetching full data for {} (last {} days, since {})", categories, days, cutoff);

        int answered = 0;
        for (String category : categories) {
            FetchBatch batch = paginator.fetchWindow(category, cutoff);
            if (batch.sourceUnavailable()) {
                log.warn("{}: source unavailable, keeping cached records ({})", category, batch.failures());
                continue;
            }
            answered++;
            int held = cacheStore.ingestFull(category, batch.records(), days);
            log.info("{}: {} torrents cached after full fetch ({} pages)", category, held, batch.pagesRequested());
        }

        if (answered == 0) {
            log.warn("No category could be fetched, serving last known cache");
            return cached(0);
        }
        int total = cacheStore.records().size();
        return cached(total);
    }

    private RefreshResult cached(int fetchedNew) {
        return new RefreshResult(cacheStore.records(), cacheStore.metadataSnapshot(fetchedNew));
    }
}
