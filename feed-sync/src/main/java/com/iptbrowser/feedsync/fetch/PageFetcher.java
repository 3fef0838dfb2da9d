package com.iptbrowser.feedsync.fetch;

import com.iptbrowser.feedsync.config.ExecutorConfig;
import com.iptbrowser.feedsync.config.FeedSyncProperties;
import com.iptbrowser.feedsync.model.TorrentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetches one listing page of one category.
 *
 * A page is requested exactly once: transport failures (timeouts, refused
 * connections, non-2xx responses) are logged and reported as a failed page
 * with no records. Nothing here retries or backs off.
 *
 * Besides the connect and read timeouts of the {@link RestTemplate}, each page
 * has a total deadline of {@code source.request-timeout}. A response still
 * arriving at the deadline is abandoned and the page counts as failed.
 */
@Service
@Slf4j
public class PageFetcher {

    private static final int BUFFER_SIZE = 8192;

    private final RestTemplate restTemplate;
    private final ListingParser parser;
    private final FeedSyncProperties properties;
    private final ThreadPoolTaskExecutor pageFetchExecutor;

    public PageFetcher(RestTemplate restTemplate,
                       ListingParser parser,
                       FeedSyncProperties properties,
                       @Qualifier(ExecutorConfig.PAGE_FETCH_EXECUTOR) ThreadPoolTaskExecutor pageFetchExecutor) {
        this.restTemplate = restTemplate;
        this.parser = parser;
        this.properties = properties;
        this.pageFetchExecutor = pageFetchExecutor;
    }

    /**
     * @param category category name, e.g. "PC-ISO"
     * @param offset   row offset of the page (0 for the newest page)
     * @return records on that page; empty when the page is empty or could not be fetched
     */
    public List<TorrentRecord> fetch(String category, int offset) {
        return fetchPage(category, offset).records();
    }

    public PageResult fetchPage(String category, int offset) {
        String categoryId = properties.getSource().getCategories().get(category);
        if (categoryId == null) {
            log.warn("Unknown category '{}', skipping", category);
            return PageResult.of(List.of());
        }

        URI uri = pageUri(categoryId, offset);
        Duration limit = properties.getSource().getRequestTimeout();
        long deadline = System.nanoTime() + limit.toNanos();
        log.debug("Fetching {} page at offset {}: {}", category, offset, uri);

        Future<String> exchange;
        try {
            exchange = pageFetchExecutor.submit(() -> download(uri, deadline, limit));
        } catch (TaskRejectedException e) {
            log.error("No worker free for {} offset {}: {}", category, offset, e.getMessage());
            return PageResult.failure(category + "@" + offset + ": no worker free");
        }

        String body;
        try {
            body = exchange.get(limit.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            exchange.cancel(true);
            log.error("Fetch timed out for {} offset {} after {}", category, offset, limit);
            return PageResult.failure(category + "@" + offset + ": timed out after " + limit);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Fetch failed for {} offset {}: {}", category, offset, cause.getMessage());
            return PageResult.failure(category + "@" + offset + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            return PageResult.failure(category + "@" + offset + ": interrupted");
        }

        if (body == null || body.isBlank()) {
            return PageResult.of(List.of());
        }

        try {
            List<TorrentRecord> records = parser.parse(body, category);
            log.debug("{} offset {}: {} records", category, offset, records.size());
            return PageResult.of(records);
        } catch (RuntimeException e) {
            log.error("Parser failed on {} offset {}: {}", category, offset, e.getMessage(), e);
            return PageResult.of(List.of());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    URI pageUri(String categoryId, int offset) {
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(properties.getSource().getBaseUrl() + "/t")
                .query(categoryId);
        if (offset > 0) {
            builder.queryParam("o", offset);
        }
        return builder.build().toUri();
    }

    private String download(URI uri, long deadline, Duration limit) {
        return restTemplate.execute(uri, HttpMethod.GET,
                request -> request.getHeaders().addAll(headers()),
                response -> readBody(response, deadline, limit));
    }

    /** Reads the body, giving up once the deadline passes or the caller cancelled. */
    private static String readBody(ClientHttpResponse response, long deadline, Duration limit) throws IOException {
        MediaType contentType = response.getHeaders().getContentType();
        Charset charset = contentType != null && contentType.getCharset() != null
                ? contentType.getCharset()
                : StandardCharsets.UTF_8;

        ByteArrayOutputStream body = new ByteArrayOutputStream();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = response.getBody()) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                body.write(buffer, 0, read);
                if (System.nanoTime() - deadline > 0 || Thread.currentThread().isInterrupted()) {
                    throw new IOException("page body not complete, timed out after " + limit);
                }
            }
        }
        return body.toString(charset);
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, properties.getSource().getUserAgent());
        String cookie = properties.getSource().getCookie();
        if (cookie != null && !cookie.isBlank()) {
            headers.set(HttpHeaders.COOKIE, cookie);
        }
        return headers;
    }
}
