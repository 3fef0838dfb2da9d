package com.iptbrowser.feedsync.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.iptbrowser.feedsync.config.FeedSyncProperties;
import com.iptbrowser.feedsync.model.CacheDocument;
import com.iptbrowser.feedsync.model.CacheMetadata;
import com.iptbrowser.feedsync.model.TorrentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the cache file.
 *
 * Writes go to {@code <file>.tmp} and are renamed over the canonical file, after
 * the previous canonical file has been copied to {@code <file>.backup}. A crash
 * mid-write therefore leaves the last good file in place.
 *
 * Two layouts are understood on load:
 * <pre>
 *   current: {"metadata": {"created_at", "updated_at", "default_window_days", "categories"}, "data": [...]}
 *   legacy:  {"timestamp": "...", "data": [...]}
 * </pre>
 * A legacy file is converted in memory; the caller is told to write it back.
 */
@Component
@Slf4j
public class CacheFileRepository {

    private static final TypeReference<List<TorrentRecord>> RECORD_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final FeedSyncProperties properties;
    private final Path file;
    private final Path backup;
    private final Path temp;

    /** False while the canonical file is known to be unreadable; it must not become the backup. */
    private volatile boolean canonicalReadable = true;

    public CacheFileRepository(ObjectMapper objectMapper, FeedSyncProperties properties) {
        this.mapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.properties = properties;
        this.file = Paths.get(properties.getCache().getFile()).toAbsolutePath();
        this.backup = file.resolveSibling(file.getFileName() + ".backup");
        this.temp = file.resolveSibling(file.getFileName() + ".tmp");
    }

    /**
     * Load the canonical file, falling back to the backup. Never throws.
     *
     * @return empty when neither file exists or can be read
     */
    public Optional<LoadResult> load() {
        if (Files.exists(file)) {
            try {
                return Optional.of(read(file, false));
            } catch (IOException | RuntimeException e) {
                canonicalReadable = false;
                log.error("Cache file {} is unreadable: {}", file, e.getMessage());
            }
        }

        if (Files.exists(backup)) {
            try {
                LoadResult restored = read(backup, true);
                log.warn("Restored cache from backup {}", backup);
                return Optional.of(restored);
            } catch (IOException | RuntimeException e) {
                log.error("Backup cache file {} is unreadable too: {}", backup, e.getMessage());
            }
        }
        return Optional.empty();
    }

    public void save(CacheDocument document) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        mapper.writeValue(temp.toFile(), document);

        if (Files.exists(file) && canonicalReadable) {
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
        }
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic rename not supported for {}, replacing in place", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        canonicalReadable = true;
    }

    public Path location() {
        return file;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private LoadResult read(Path path, boolean fromBackup) throws IOException {
        JsonNode root = mapper.readTree(path.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("expected a JSON object in " + path);
        }

        if (root.has("timestamp") && !root.has("metadata")) {
            log.info("Migrating cache {} from legacy format", path);
            return new LoadResult(migrateLegacy(root), true, fromBackup);
        }

        CacheDocument document = mapper.treeToValue(root, CacheDocument.class);
        if (document.getMetadata() == null) {
            document.setMetadata(new CacheMetadata());
        }
        if (document.getData() == null) {
            document.setData(new ArrayList<>());
        }
        return new LoadResult(document, false, fromBackup);
    }

    private CacheDocument migrateLegacy(JsonNode root) {
        JsonNode data = root.get("data");
        List<TorrentRecord> records = data == null || data.isNull()
                ? new ArrayList<>()
                : new ArrayList<>(mapper.convertValue(data, RECORD_LIST));

        JsonNode timestamp = root.get("timestamp");
        LocalDateTime cachedAt = timestamp == null || timestamp.isNull() || timestamp.asText().isBlank()
                ? null
                : LocalDateTime.parse(timestamp.asText());

        CacheMetadata metadata = new CacheMetadata(
                cachedAt,
                cachedAt,
                properties.getCache().getDefaultWindowDays(),
                CacheStore.rebuild(records));
        return new CacheDocument(metadata, records);
    }

    /**
     * @param document   the loaded cache
     * @param migrated   converted from the legacy layout
     * @param fromBackup the canonical file was unusable and the backup was read
     */
    public record LoadResult(CacheDocument document, boolean migrated, boolean fromBackup) {

        public boolean needsSave() {
            return migrated || fromBackup;
        }
    }
}
