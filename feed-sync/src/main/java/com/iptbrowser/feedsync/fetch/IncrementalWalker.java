package com.iptbrowser.feedsync.fetch;

import com.iptbrowser.feedsync.config.FeedSyncProperties;
import com.iptbrowser.feedsync.model.TorrentRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks one category from the newest page until it reaches a record it already has.
 *
 * The listing is assumed to be newest first, so the first record that is not
 * strictly newer than the watermark ends the walk, even mid-page. Without a
 * watermark only the first page is read and all of it counts as new.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IncrementalWalker {

    private final PageFetcher pageFetcher;
    private final FeedSyncProperties properties;

    /**
     * @param watermark newest timestamp already cached for the category, or null on first sync
     * @return new records in the order they were found
     */
    public FetchBatch fetchSince(String category, LocalDateTime watermark) {
        int pageSize = properties.getPaging().getPageSize();
        int maxPages = watermark == null ? 1 : Math.max(1, properties.getPaging().getIncrementalMaxPages());

        List<TorrentRecord> fresh = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        int requested = 0;
        boolean reachedKnown = false;

        for (int page = 0; page < maxPages && !reachedKnown; page++) {
            PageResult result = pageFetcher.fetchPage(category, page * pageSize);
            requested++;

            if (result.failed()) {
                if (page == 0) {
                    return FetchBatch.unavailable(result.error());
                }
                failures.add(result.error());
                break;
            }
            if (result.isEmpty()) break;

            for (TorrentRecord record : result.records()) {
                if (watermark == null || isNewer(record, watermark)) {
                    fresh.add(record);
                } else {
                    reachedKnown = true;
                    break;
                }
            }
        }

        if (!reachedKnown && watermark != null && requested == maxPages) {
            log.info("{}: stopped after {} pages without reaching known records", category, requested);
        }
        log.info("{}: {} new records since {} ({} pages)", category, fresh.size(), watermark, requested);
        return new FetchBatch(fresh, requested, failures, false);
    }

    private static boolean isNewer(TorrentRecord record, LocalDateTime watermark) {
        return record.getTimestamp() != null && record.getTimestamp().isAfter(watermark);
    }
}
