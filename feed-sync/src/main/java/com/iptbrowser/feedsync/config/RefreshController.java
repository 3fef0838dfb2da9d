package com.iptbrowser.feedsync.config;

import com.iptbrowser.feedsync.model.CacheSummary;
import com.iptbrowser.feedsync.model.RefreshMode;
import com.iptbrowser.feedsync.model.RefreshResult;
import com.iptbrowser.feedsync.model.TorrentRecord;
import com.iptbrowser.feedsync.service.RefreshOrchestrator;
import com.iptbrowser.feedsync.store.CacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class RefreshController {

    private final RefreshOrchestrator orchestrator;
    private final CacheStore cacheStore;
    private final FeedSyncProperties properties;

    /**
     * Torrents for the requested categories, refreshed according to mode.
     *
     * GET /api/torrents?mode=incremental&categories=PC-ISO,PC-Rip&days=7
     *
     * Filtering and sorting beyond category are left to the client.
     */
    @GetMapping("/api/torrents")
    public ResponseEntity<?> torrents(
            @RequestParam(defaultValue = "full") String mode,
            @RequestParam(required = false) String categories,
            @RequestParam(required = false) String days) {
        RefreshMode refreshMode;
        try {
            refreshMode = RefreshMode.fromValue(mode);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        List<String> requested = splitCategories(categories);
        RefreshResult result = orchestrator.refresh(refreshMode, requested, parseDays(days), false);

        List<TorrentRecord> torrents = requested == null
                ? result.records()
                : result.records().stream().filter(t -> requested.contains(t.getCategory())).toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("torrents", torrents);
        body.put("metadata", result.summary());
        body.put("count", torrents.size());
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/refresh?force=true runs a full refresh, otherwise an incremental one.
     */
    @GetMapping("/api/refresh")
    public ResponseEntity<Map<String, Object>> refresh(
            @RequestParam(defaultValue = "false") boolean force,
            @RequestParam(required = false) String categories,
            @RequestParam(required = false) String days) {
        RefreshMode mode = force ? RefreshMode.FULL : RefreshMode.INCREMENTAL;
        RefreshResult result = orchestrator.refresh(mode, splitCategories(categories), parseDays(days), force);
        CacheSummary summary = result.summary();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("count", result.records().size());
        body.put("new_torrents", summary.fetchedNew());
        body.put("mode_used", mode.value());
        body.put("message", (force ? "Full refresh" : "Incremental refresh") + ": " + summary.fetchedNew() + " new torrents");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/api/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        CacheSummary summary = cacheStore.metadataSnapshot(0);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total", summary.totalTorrents());
        if (summary.totalTorrents() == 0) {
            // an emptied store still has updated_at; there is no cache to age
            body.put("cache_age", null);
            body.put("cache_valid", false);
            return ResponseEntity.ok(body);
        }
        body.put("cache_age", summary.cacheAge());
        body.put("categories", summary.categories());
        body.put("cache_valid", cacheStore.isFresh(properties.getCache().getMaxAge()));
        body.put("default_window_days", cacheStore.defaultWindowDays());
        return ResponseEntity.ok(body);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private List<String> splitCategories(String categories) {
        if (categories == null || categories.isBlank()) return null;
        return Arrays.stream(categories.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private Integer parseDays(String days) {
        if (days == null || days.isBlank()) return null;
        try {
            return Integer.parseInt(days.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric days '{}'", days);
            return null;
        }
    }
}
