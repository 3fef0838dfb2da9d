package com.iptbrowser.feedsync.fetch;

import com.iptbrowser.feedsync.config.ExecutorConfig;
import com.iptbrowser.feedsync.config.FeedSyncProperties;
import com.iptbrowser.feedsync.model.TorrentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Collects every record of one category uploaded since a cutoff, for full refreshes.
 *
 * Page 0 is fetched on the calling thread. When page 0 already reaches past the
 * cutoff nothing else is requested; otherwise a fixed batch of further pages is
 * handed to the paginator pool so the source never sees more than
 * {@code paging.concurrency} requests at once. The batch is awaited until every
 * page is done or {@code paging.window-timeout} runs out; pages still running then
 * are cancelled and reported as failures.
 */
@Component
@Slf4j
public class ConcurrentPaginator {

    private final PageFetcher pageFetcher;
    private final FeedSyncProperties properties;
    private final ThreadPoolTaskExecutor paginatorExecutor;

    public ConcurrentPaginator(PageFetcher pageFetcher,
                               FeedSyncProperties properties,
                               @Qualifier(ExecutorConfig.PAGINATOR_EXECUTOR) ThreadPoolTaskExecutor paginatorExecutor) {
        this.pageFetcher = pageFetcher;
        this.properties = properties;
        this.paginatorExecutor = paginatorExecutor;
    }

    public FetchBatch fetchWindow(String category, LocalDateTime cutoff) {
        PageResult first = pageFetcher.fetchPage(category, 0);
        if (first.failed()) {
            return FetchBatch.unavailable(first.error());
        }
        if (first.isEmpty()) {
            log.info("{}: first page is empty, nothing to fetch", category);
            return new FetchBatch(List.of(), 1, List.of(), false);
        }

        List<TorrentRecord> collected = new ArrayList<>(withinWindow(first.records(), cutoff));

        LocalDateTime oldest = first.records().stream()
                .map(TorrentRecord::getTimestamp)
                .filter(Objects::nonNull)
                .min(LocalDateTime::compareTo)
                .orElse(null);
        if (oldest != null && oldest.isBefore(cutoff)) {
            log.info("{}: window since {} satisfied by first page ({} records)", category, cutoff, collected.size());
            return new FetchBatch(collected, 1, List.of(), false);
        }

        int pageSize = properties.getPaging().getPageSize();
        int extraPages = properties.getPaging().getFullWindowPages();

        Duration windowTimeout = properties.getPaging().getWindowTimeout();
        long deadline = System.nanoTime() + windowTimeout.toNanos();

        CompletionService<PageResult> completion = new ExecutorCompletionService<>(paginatorExecutor);
        Map<Future<PageResult>, Integer> pending = new LinkedHashMap<>();
        for (int page = 1; page <= extraPages; page++) {
            int offset = page * pageSize;
            pending.put(completion.submit(() -> pageFetcher.fetchPage(category, offset)), offset);
        }

        List<String> failures = new ArrayList<>();
        while (!pending.isEmpty()) {
            Future<PageResult> next;
            try {
                next = completion.poll(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.add(category + ": interrupted while waiting for pages");
                break;
            }
            if (next == null) break;
            pending.remove(next);
            collect(category, next, cutoff, collected, failures);
        }

        for (Map.Entry<Future<PageResult>, Integer> straggler : pending.entrySet()) {
            Future<PageResult> future = straggler.getKey();
            if (future.cancel(true)) {
                failures.add(category + "@" + straggler.getValue() + ": not finished within " + windowTimeout);
            } else {
                collect(category, future, cutoff, collected, failures);
            }
        }

        if (!failures.isEmpty()) {
            log.warn("{}: {} of {} pages failed: {}", category, failures.size(), extraPages, failures);
        }
        log.info("{}: {} records since {} across {} pages", category, collected.size(), cutoff, extraPages + 1);
        return new FetchBatch(collected, extraPages + 1, failures, false);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** Adds a finished page to the batch; only called for futures that are done. */
    private static void collect(String category, Future<PageResult> future, LocalDateTime cutoff,
                                List<TorrentRecord> collected, List<String> failures) {
        try {
            PageResult page = future.get();
            if (page.failed()) {
                failures.add(page.error());
            } else {
                collected.addAll(withinWindow(page.records(), cutoff));
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            failures.add(category + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failures.add(category + ": interrupted while reading a finished page");
        }
    }

    private static List<TorrentRecord> withinWindow(Collection<TorrentRecord> records, LocalDateTime cutoff) {
        return records.stream()
                .filter(r -> r.getTimestamp() != null && !r.getTimestamp().isBefore(cutoff))
                .toList();
    }
}
