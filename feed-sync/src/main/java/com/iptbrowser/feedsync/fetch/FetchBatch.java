package com.iptbrowser.feedsync.fetch;

import com.iptbrowser.feedsync.model.TorrentRecord;

import java.util.List;

/**
 * Records gathered for one category by a paginated walk.
 *
 * @param records           records that passed the cutoff / watermark, unordered
 * @param pagesRequested    number of page requests issued
 * @param failures          per-page failure messages, for logging
 * @param sourceUnavailable the first page could not be fetched at all
 */
public record FetchBatch(List<TorrentRecord> records,
                         int pagesRequested,
                         List<String> failures,
                         boolean sourceUnavailable) {

    public static FetchBatch unavailable(String error) {
        return new FetchBatch(List.of(), 1, List.of(error), true);
    }
}
