package com.iptbrowser.feedsync.store;

import com.iptbrowser.feedsync.config.FeedSyncProperties;
import com.iptbrowser.feedsync.model.CacheDocument;
import com.iptbrowser.feedsync.model.CacheMetadata;
import com.iptbrowser.feedsync.model.CacheSummary;
import com.iptbrowser.feedsync.model.CategoryMetadata;
import com.iptbrowser.feedsync.model.TorrentRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The process-wide torrent cache: records newest first, plus metadata derived from them.
 *
 * Invariants after every mutation:
 *  - no two records share an id
 *  - records are ordered by timestamp, newest first
 *  - the per-category metadata equals {@link #rebuild(Collection)} of the records
 *
 * Every mutation holds the write lock for the whole merge, rebuild and save, so
 * there is exactly one writer at a time. A failed save is logged and the
 * in-memory state stays authoritative; it is written again on the next
 * mutation or at shutdown.
 */
@Component
@Slf4j
public class CacheStore {

    private static final Comparator<TorrentRecord> NEWEST_FIRST = Comparator.comparing(
            TorrentRecord::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()));

    private final CacheFileRepository repository;
    private final Deduplicator deduplicator;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private List<TorrentRecord> records = new ArrayList<>();
    private Map<String, CategoryMetadata> categories = new LinkedHashMap<>();
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private int defaultWindowDays;
    private boolean dirty;

    public CacheStore(CacheFileRepository repository, Deduplicator deduplicator,
                      FeedSyncProperties properties, Clock clock) {
        this.repository = repository;
        this.deduplicator = deduplicator;
        this.clock = clock;
        this.defaultWindowDays = properties.getCache().getDefaultWindowDays();
    }

    @PostConstruct
    public void load() {
        lock.writeLock().lock();
        try {
            Optional<CacheFileRepository.LoadResult> loaded = repository.load();
            if (loaded.isEmpty()) {
                log.info("No usable cache at {}, starting empty", repository.location());
                return;
            }

            CacheDocument document = loaded.get().document();
            CacheMetadata metadata = document.getMetadata();

            records = sortNewestFirst(deduplicator.merge(List.of(), document.getData()));
            categories = rebuild(records);
            createdAt = metadata.getCreatedAt();
            updatedAt = metadata.getUpdatedAt();
            if (metadata.getDefaultWindowDays() > 0) {
                defaultWindowDays = metadata.getDefaultWindowDays();
            }

            if (!categories.equals(metadata.getCategories())) {
                log.warn("Stored category metadata did not match the cached records; rebuilt it");
            }
            log.info("Loaded {} torrents from cache ({} categories)", records.size(), categories.size());

            if (loaded.get().needsSave()) {
                persist();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace everything cached for {@code category} with the given window.
     *
     * @return number of records the category holds afterwards
     */
    public int ingestFull(String category, List<TorrentRecord> fetched, int windowDays) {
        lock.writeLock().lock();
        try {
            List<TorrentRecord> window = deduplicator.merge(List.of(), fetched);
            if (window.size() < fetched.size()) {
                log.info("{}: removed {} duplicate torrents before caching", category, fetched.size() - window.size());
            }

            List<TorrentRecord> others = records.stream()
                    .filter(r -> !category.equals(r.getCategory()))
                    .toList();

            records = sortNewestFirst(deduplicator.merge(others, window));
            categories = rebuild(records);

            LocalDateTime now = LocalDateTime.now(clock);
            if (createdAt == null) {
                createdAt = now;
            }
            updatedAt = now;
            defaultWindowDays = windowDays;

            persist();

            CategoryMetadata meta = categories.get(category);
            return meta == null ? 0 : meta.count();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Add the records not cached yet.
     *
     * @return number of records actually added
     */
    public int ingestIncremental(String category, List<TorrentRecord> fetched) {
        lock.writeLock().lock();
        try {
            List<TorrentRecord> merged = deduplicator.merge(records, fetched);
            int added = merged.size() - records.size();

            records = sortNewestFirst(merged);
            categories = rebuild(records);

            LocalDateTime now = LocalDateTime.now(clock);
            if (createdAt == null) {
                createdAt = now;
            }
            updatedAt = now;

            persist();

            log.info("{}: added {} new torrents ({} fetched)", category, added, fetched.size());
            return added;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isFresh(Duration maxAge) {
        lock.readLock().lock();
        try {
            return updatedAt != null
                    && Duration.between(updatedAt, LocalDateTime.now(clock)).compareTo(maxAge) < 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheSummary metadataSnapshot(int fetchedNew) {
        lock.readLock().lock();
        try {
            Map<String, Integer> counts = new LinkedHashMap<>();
            categories.forEach((name, meta) -> counts.put(name, meta.count()));
            return new CacheSummary(cacheAge(), counts, fetchedNew, records.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Immutable view of the records, newest first */
    public List<TorrentRecord> records() {
        lock.readLock().lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, CategoryMetadata> categoryMetadata() {
        lock.readLock().lock();
        try {
            return Map.copyOf(categories);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Watermark for incremental walks */
    public Optional<LocalDateTime> newestTimestamp(String category) {
        lock.readLock().lock();
        try {
            CategoryMetadata meta = categories.get(category);
            return meta == null ? Optional.empty() : Optional.ofNullable(meta.newestTimestamp());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int defaultWindowDays() {
        lock.readLock().lock();
        try {
            return defaultWindowDays;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<LocalDateTime> createdAt() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(createdAt);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<LocalDateTime> updatedAt() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(updatedAt);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Write out state whose last save failed. */
    @PreDestroy
    public void flush() {
        lock.writeLock().lock();
        try {
            if (dirty) {
                log.info("Flushing unsaved cache before shutdown");
                persist();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Derive per-category metadata from records. Records without a category are not counted.
     */
    public static Map<String, CategoryMetadata> rebuild(Collection<TorrentRecord> records) {
        Map<String, CategoryMetadata> result = new LinkedHashMap<>();
        for (TorrentRecord record : records) {
            if (record.getCategory() == null) continue;
            result.merge(record.getCategory(),
                    CategoryMetadata.empty().include(record.getTimestamp()),
                    (current, ignored) -> current.include(record.getTimestamp()));
        }
        return result;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static List<TorrentRecord> sortNewestFirst(List<TorrentRecord> unsorted) {
        List<TorrentRecord> sorted = new ArrayList<>(unsorted);
        sorted.sort(NEWEST_FIRST);
        return sorted;
    }

    private String cacheAge() {
        if (updatedAt == null) return null;
        long minutes = Duration.between(updatedAt, LocalDateTime.now(clock)).toMinutes();
        return minutes < 60 ? minutes + " minutes ago" : (minutes / 60) + " hours ago";
    }

    /** Caller holds the write lock. */
    private void persist() {
        CacheDocument document = new CacheDocument(
                new CacheMetadata(createdAt, updatedAt, defaultWindowDays, new LinkedHashMap<>(categories)),
                new ArrayList<>(records));
        try {
            repository.save(document);
            dirty = false;
            log.debug("Saved {} torrents to {}", records.size(), repository.location());
        } catch (IOException | RuntimeException e) {
            dirty = true;
            log.error("Could not save cache to {}: {}", repository.location(), e.getMessage(), e);
        }
    }
}
