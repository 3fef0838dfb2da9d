package com.iptbrowser.feedsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Per-category summary derived from the cached records of that category.
 * Never edited on its own: always rebuilt from the records.
 */
public record CategoryMetadata(
        @JsonProperty("newest_timestamp") LocalDateTime newestTimestamp,
        @JsonProperty("oldest_timestamp") LocalDateTime oldestTimestamp,
        @JsonProperty("count") int count) {

    public static CategoryMetadata empty() {
        return new CategoryMetadata(null, null, 0);
    }

    /** Account for one more record; a record without a timestamp only adds to the count. */
    public CategoryMetadata include(LocalDateTime timestamp) {
        if (timestamp == null) return new CategoryMetadata(newestTimestamp, oldestTimestamp, count + 1);
        LocalDateTime newest = newestTimestamp == null || timestamp.isAfter(newestTimestamp) ? timestamp : newestTimestamp;
        LocalDateTime oldest = oldestTimestamp == null || timestamp.isBefore(oldestTimestamp) ? timestamp : oldestTimestamp;
        return new CategoryMetadata(newest, oldest, count + 1);
    }
}
