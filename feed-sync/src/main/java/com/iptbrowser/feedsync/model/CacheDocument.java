package com.iptbrowser.feedsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk shape of the cache file: {"metadata": {...}, "data": [...]}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheDocument {

    private CacheMetadata metadata = new CacheMetadata();
    private List<TorrentRecord> data = new ArrayList<>();
}
