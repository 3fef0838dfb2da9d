package com.iptbrowser.feedsync.fetch;

import com.iptbrowser.feedsync.config.FeedSyncProperties;
import com.iptbrowser.feedsync.model.TorrentRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort parser for the browse page's {@code <table id="torrents">}.
 *
 * Field extraction is positional and heuristic:
 *  - the title link is the first {@code /t/{id}} link that is not a bookmark or comment link
 *  - size is the first "N.N GB|MB|TB|KB" in the row text
 *  - seeders / leechers / snatched are the last three purely numeric cells
 *  - upload age is the first "N.N unit(s) ago" in the row text
 *
 * Rows that do not carry a title link (headers, separators) are skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HtmlListingParser implements ListingParser {

    private static final Pattern TABLE = Pattern.compile(
            "<table[^>]*\\bid\\s*=\\s*[\"']torrents[\"'][^>]*>(.*?)</table>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ROW = Pattern.compile(
            "<tr[^>]*>(.*?)</tr>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern CELL = Pattern.compile(
            "<td[^>]*>(.*?)</td>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern LINK = Pattern.compile(
            "<a[^>]*\\bhref\\s*=\\s*[\"']([^\"']*)[\"'][^>]*>(.*?)</a>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern TORRENT_ID = Pattern.compile("/t/(\\d+)");
    private static final Pattern SIZE = Pattern.compile(
            "([\\d.]+)\\s*(TB|GB|MB|KB)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern FREELEECH = Pattern.compile("freeleech", Pattern.CASE_INSENSITIVE);

    private final FeedSyncProperties properties;
    private final Clock clock;

    @Override
    public List<TorrentRecord> parse(String pageContent, String category) {
        if (pageContent == null || pageContent.isBlank()) return List.of();

        Matcher table = TABLE.matcher(pageContent);
        if (!table.find()) {
            log.warn("No torrents table found on {} page", category);
            return List.of();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<TorrentRecord> records = new ArrayList<>();
        int skipped = 0;

        Matcher row = ROW.matcher(table.group(1));
        while (row.find()) {
            try {
                TorrentRecord record = parseRow(row.group(1), category, now);
                if (record != null) {
                    records.add(record);
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.debug("Skipping unreadable {} row: {}", category, e.getMessage());
                skipped++;
            }
        }

        log.debug("Parsed {} page: {} records, {} rows skipped", category, records.size(), skipped);
        return records;
    }

    private TorrentRecord parseRow(String rowHtml, String category, LocalDateTime now) {
        List<String> cells = new ArrayList<>();
        Matcher cell = CELL.matcher(rowHtml);
        while (cell.find()) {
            cells.add(text(cell.group(1)));
        }
        if (cells.size() < 5) return null;

        String id = null;
        String name = null;
        String downloadLink = null;

        Matcher link = LINK.matcher(rowHtml);
        while (link.find()) {
            String href = link.group(1);
            if (downloadLink == null && href.contains("/download.php/")) {
                downloadLink = absolute(href);
                continue;
            }
            if (id == null && !href.contains("bookmark") && !href.contains("comment")) {
                Matcher idMatch = TORRENT_ID.matcher(href);
                if (idMatch.find()) {
                    id = idMatch.group(1);
                    name = text(link.group(2));
                }
            }
        }
        if (id == null) return null;

        String rowText = String.join(" ", cells);

        Matcher size = SIZE.matcher(rowText);

        List<Integer> numbers = new ArrayList<>();
        for (String c : cells) {
            if (!c.isEmpty() && c.chars().allMatch(Character::isDigit) && c.length() < 10) {
                numbers.add(Integer.parseInt(c));
            }
        }
        int n = numbers.size();

        return TorrentRecord.builder()
                .id(id)
                .category(category)
                .name(name)
                .size(size.find() ? size.group(0) : "Unknown")
                .seeders(n >= 3 ? numbers.get(n - 3) : 0)
                .leechers(n >= 2 ? numbers.get(n - 2) : 0)
                .snatched(n >= 1 ? numbers.get(n - 1) : 0)
                .uploadTime(RelativeAgeParser.find(rowText).orElse("Unknown"))
                .timestamp(RelativeAgeParser.resolve(rowText, now))
                .downloadLink(downloadLink)
                .url(absolute("/t/" + id))
                .freeleech(FREELEECH.matcher(rowHtml).find())
                .build();
    }

    private String absolute(String href) {
        if (href.startsWith("http://") || href.startsWith("https://")) return href;
        String base = properties.getSource().getBaseUrl();
        return href.startsWith("/") ? base + href : base + "/" + href;
    }

    private static String text(String html) {
        return TAG.matcher(html).replaceAll(" ")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
