package com.iptbrowser.feedsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheMetadata {

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    /** Last successful fetch cycle; drives freshness checks */
    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    @JsonProperty("default_window_days")
    private int defaultWindowDays;

    private Map<String, CategoryMetadata> categories = new LinkedHashMap<>();
}
