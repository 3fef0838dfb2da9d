package com.iptbrowser.feedsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Reporting view of the cache returned alongside refresh results.
 *
 * @param cacheAge      "N minutes ago" / "N hours ago", null if never updated
 * @param categories    record count per category
 * @param fetchedNew    records added (incremental) or held after merge (full)
 * @param totalTorrents size of the whole store
 */
public record CacheSummary(
        @JsonProperty("cache_age") String cacheAge,
        @JsonProperty("categories") Map<String, Integer> categories,
        @JsonProperty("fetched_new") int fetchedNew,
        @JsonProperty("total_torrents") int totalTorrents) {
}
