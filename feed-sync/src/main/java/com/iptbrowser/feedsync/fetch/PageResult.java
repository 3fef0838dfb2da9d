package com.iptbrowser.feedsync.fetch;

import com.iptbrowser.feedsync.model.TorrentRecord;

import java.util.List;

/**
 * Outcome of one page request. A failed page carries no records.
 */
public record PageResult(List<TorrentRecord> records, boolean failed, String error) {

    public static PageResult of(List<TorrentRecord> records) {
        return new PageResult(List.copyOf(records), false, null);
    }

    public static PageResult failure(String error) {
        return new PageResult(List.of(), true, error);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
