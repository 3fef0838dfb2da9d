package com.iptbrowser.feedsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RefreshMode {

    /** Serve the cache as-is, never touch the network */
    CACHE_ONLY("cache-only"),
    /** Walk each category from the newest page until a known record shows up */
    INCREMENTAL("incremental"),
    /** Re-fetch the whole time window, unless the cache is still fresh */
    FULL("full");

    private final String value;

    RefreshMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static RefreshMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(m -> m.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "mode must be one of cache-only, incremental, full (got '" + value + "')"));
    }
}
