package com.iptbrowser.feedsync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iptbrowser.feedsync.config.FeedSyncProperties;
import com.iptbrowser.feedsync.model.CacheDocument;
import com.iptbrowser.feedsync.model.CacheSummary;
import com.iptbrowser.feedsync.model.CategoryMetadata;
import com.iptbrowser.feedsync.model.TorrentRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CacheStoreTest {

    private static final Instant INSTANT = Instant.parse("2026-03-01T12:00:00Z");
    private static final LocalDateTime NOW = LocalDateTime.ofInstant(INSTANT, ZoneOffset.UTC);

    @TempDir
    Path dir;

    private FeedSyncProperties properties;
    private CacheFileRepository repository;
    private CacheStore store;

    @BeforeEach
    void setUp() {
        properties = new FeedSyncProperties();
        properties.getCache().setFile(dir.resolve("cache.json").toString());
        repository = new CacheFileRepository(new ObjectMapper(), properties);
        store = newStore(Clock.fixed(INSTANT, ZoneOffset.UTC));
        store.load();
    }

    @Test
    @DisplayName("incremental merge drops the known record and advances the watermark")
    void incrementalScenario() {
        store.ingestFull("A", List.of(record("a1", "A", 10), record("a2", "A", 5)), 30);

        int added = store.ingestIncremental("A", List.of(record("a3", "A", 1), record("a2", "A", 5)));

        assertThat(added).isEqualTo(1);
        assertThat(store.records()).extracting(TorrentRecord::getId).containsExactly("a3", "a2", "a1");
        assertThat(store.newestTimestamp("A")).contains(NOW.minusDays(1));
        assertThat(store.categoryMetadata().get("A").count()).isEqualTo(3);
    }

    @Test
    @DisplayName("full ingest replaces only the given category and keeps the others")
    void fullReplacesCategory() {
        store.ingestFull("A", List.of(record("a1", "A", 3), record("a2", "A", 4)), 30);
        store.ingestFull("B", List.of(record("b1", "B", 2)), 30);

        int held = store.ingestFull("A", List.of(record("a9", "A", 1)), 7);

        assertThat(held).isEqualTo(1);
        assertThat(store.records()).extracting(TorrentRecord::getId).containsExactly("a9", "b1");
        assertThat(store.defaultWindowDays()).isEqualTo(7);
    }

    @Test
    @DisplayName("full ingest removes duplicates within the fetched window")
    void fullDeduplicatesWindow() {
        store.ingestFull("A", List.of(record("a1", "A", 1), record("a2", "A", 2), record("a1", "A", 3)), 30);

        assertThat(store.records()).extracting(TorrentRecord::getId).containsExactly("a1", "a2");
        assertThat(store.records().get(0).getTimestamp()).isEqualTo(NOW.minusDays(1));
    }

    @Test
    @DisplayName("records stay unique, ordered newest first and consistent with their metadata")
    void invariantsHoldAfterMutations() {
        store.ingestFull("A", List.of(record("1", "A", 9), record("2", "A", 1), record("3", "A", 4)), 30);
        store.ingestIncremental("B", List.of(record("4", "B", 2), record("1", "B", 0), record("5", "B", 7)));
        store.ingestFull("B", List.of(record("6", "B", 3), record("2", "B", 6)), 30);

        List<TorrentRecord> records = store.records();
        assertThat(records).extracting(TorrentRecord::getId).doesNotHaveDuplicates();
        for (int i = 1; i < records.size(); i++) {
            assertThat(records.get(i - 1).getTimestamp()).isAfterOrEqualTo(records.get(i).getTimestamp());
        }
        assertThat(store.categoryMetadata()).isEqualTo(CacheStore.rebuild(records));
    }

    @Test
    @DisplayName("created_at is kept across ingests, updated_at follows the clock")
    void timestamps() {
        store.ingestFull("A", List.of(record("1", "A", 1)), 30);

        CacheStore later = newStore(Clock.fixed(INSTANT.plus(Duration.ofHours(2)), ZoneOffset.UTC));
        later.load();
        later.ingestIncremental("A", List.of(record("2", "A", 0)));

        assertThat(later.createdAt()).contains(NOW);
        assertThat(later.updatedAt()).contains(NOW.plusHours(2));
    }

    @Test
    @DisplayName("freshness compares the last update against the max age")
    void freshness() {
        assertThat(store.isFresh(Duration.ofMinutes(15))).isFalse();

        store.ingestIncremental("A", List.of(record("1", "A", 1)));
        assertThat(store.isFresh(Duration.ofMinutes(15))).isTrue();

        CacheStore later = newStore(Clock.fixed(INSTANT.plus(Duration.ofMinutes(15)), ZoneOffset.UTC));
        later.load();
        assertThat(later.isFresh(Duration.ofMinutes(15))).isFalse();
    }

    @Test
    @DisplayName("snapshot reports counts and a readable cache age")
    void snapshot() {
        store.ingestFull("A", List.of(record("1", "A", 1), record("2", "A", 2)), 30);
        store.ingestFull("B", List.of(record("3", "B", 1)), 30);

        CacheSummary minutes = newLoadedStore(INSTANT.plus(Duration.ofMinutes(42))).metadataSnapshot(5);
        CacheSummary hours = newLoadedStore(INSTANT.plus(Duration.ofMinutes(150))).metadataSnapshot(0);

        assertThat(minutes.cacheAge()).isEqualTo("42 minutes ago");
        assertThat(minutes.categories()).containsEntry("A", 2).containsEntry("B", 1);
        assertThat(minutes.fetchedNew()).isEqualTo(5);
        assertThat(minutes.totalTorrents()).isEqualTo(3);
        assertThat(hours.cacheAge()).isEqualTo("2 hours ago");
    }

    @Test
    @DisplayName("state survives a reload from disk")
    void persistsEveryMutation() {
        store.ingestFull("A", List.of(record("1", "A", 2), record("2", "A", 1)), 14);

        CacheStore reloaded = newLoadedStore(INSTANT);

        assertThat(reloaded.records()).extracting(TorrentRecord::getId).containsExactly("2", "1");
        assertThat(reloaded.categoryMetadata()).isEqualTo(store.categoryMetadata());
        assertThat(reloaded.defaultWindowDays()).isEqualTo(14);
    }

    @Test
    @DisplayName("a failed save keeps the in-memory state and is retried on flush")
    void saveFailureKeepsMemoryState() throws IOException {
        CacheFileRepository failing = mock(CacheFileRepository.class);
        when(failing.load()).thenReturn(Optional.empty());
        when(failing.location()).thenReturn(dir.resolve("cache.json"));
        doThrow(new IOException("disk full")).when(failing).save(any(CacheDocument.class));

        CacheStore memoryOnly = new CacheStore(failing, new Deduplicator(), properties, Clock.fixed(INSTANT, ZoneOffset.UTC));
        memoryOnly.load();
        memoryOnly.ingestIncremental("A", List.of(record("1", "A", 1)));

        assertThat(memoryOnly.records()).extracting(TorrentRecord::getId).containsExactly("1");

        List<CacheDocument> saved = new ArrayList<>();
        doAnswer(inv -> saved.add(inv.getArgument(0))).when(failing).save(any(CacheDocument.class));
        memoryOnly.flush();

        assertThat(saved).hasSize(1);
        assertThat(saved.get(0).getData()).extracting(TorrentRecord::getId).containsExactly("1");
    }

    @Test
    @DisplayName("rebuild derives newest, oldest and count per category")
    void rebuild() {
        List<TorrentRecord> records = List.of(
                record("1", "A", 1), record("2", "A", 6), record("3", "B", 2), record("4", null, 0));

        assertThat(CacheStore.rebuild(records))
                .containsOnlyKeys("A", "B")
                .containsEntry("A", new CategoryMetadata(NOW.minusDays(1), NOW.minusDays(6), 2))
                .containsEntry("B", new CategoryMetadata(NOW.minusDays(2), NOW.minusDays(2), 1));
    }

    @Test
    @DisplayName("loading a file whose metadata drifted from its records rebuilds the metadata")
    void repairsDriftedMetadataOnLoad() throws IOException {
        Files.writeString(dir.resolve("cache.json"), """
                {
                  "metadata": {
                    "created_at": "2026-02-01T00:00:00",
                    "updated_at": "2026-02-28T00:00:00",
                    "default_window_days": 30,
                    "categories": {"A": {"newest_timestamp": "2020-01-01T00:00:00", "oldest_timestamp": null, "count": 99}}
                  },
                  "data": [
                    {"id": "1", "category": "A", "name": "x", "timestamp": "2026-02-27T10:00:00"},
                    {"id": "1", "category": "A", "name": "dup", "timestamp": "2026-02-26T10:00:00"}
                  ]
                }
                """);

        CacheStore loaded = newLoadedStore(INSTANT);

        assertThat(loaded.records()).hasSize(1);
        assertThat(loaded.categoryMetadata().get("A"))
                .isEqualTo(new CategoryMetadata(LocalDateTime.parse("2026-02-27T10:00:00"),
                        LocalDateTime.parse("2026-02-27T10:00:00"), 1));
    }

    private CacheStore newStore(Clock clock) {
        return new CacheStore(repository, new Deduplicator(), properties, clock);
    }

    private CacheStore newLoadedStore(Instant at) {
        CacheStore s = newStore(Clock.fixed(at, ZoneOffset.UTC));
        s.load();
        return s;
    }

    private static TorrentRecord record(String id, String category, int daysAgo) {
        return TorrentRecord.builder()
                .id(id)
                .category(category)
                .name("torrent " + id)
                .size("1.0 GB")
                .timestamp(NOW.minusDays(daysAgo))
                .build();
    }
}
