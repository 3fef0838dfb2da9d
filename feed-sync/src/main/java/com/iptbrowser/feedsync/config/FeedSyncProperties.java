package com.iptbrowser.feedsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "feed-sync")
@Data
public class FeedSyncProperties {

    private Source source = new Source();
    private Cache cache = new Cache();
    private Paging paging = new Paging();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Source {
        private String baseUrl = "http://www.iptorrents.com";

        /** Raw session cookie header, e.g. "uid=123; pass=abc" */
        private String cookie = "";

        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);

        /** Total time allowed for one page, headers and body included */
        private Duration requestTimeout = Duration.ofSeconds(45);

        /** Category name to the site's numeric category id */
        private Map<String, String> categories = defaultCategories();

        private List<String> defaultCategories = List.of("PC-ISO", "PC-Rip");

        private static Map<String, String> defaultCategories() {
            Map<String, String> ids = new LinkedHashMap<>();
            ids.put("PC-ISO", "43");
            ids.put("PC-Rip", "45");
            ids.put("PC-Mixed", "2");
            ids.put("Nintendo", "47");
            ids.put("Playstation", "71");
            ids.put("Xbox", "44");
            ids.put("Wii", "50");
            return ids;
        }
    }

    @Data
    public static class Cache {
        private String file = "cache.json";

        /** A full refresh inside this window is served from cache */
        private Duration maxAge = Duration.ofMinutes(15);

        private int defaultWindowDays = 30;
    }

    @Data
    public static class Paging {
        /** Listing rows per page; also the offset stride */
        private int pageSize = 100;

        /** Extra pages scheduled after page 0 in a full-window fetch */
        private int fullWindowPages = 10;

        /** In-flight page requests during a full-window fetch */
        private int concurrency = 3;

        private int incrementalMaxPages = 5;

        /** Pages of a full-window fetch still running after this are abandoned as failed */
        private Duration windowTimeout = Duration.ofMinutes(4);
    }

    @Data
    public static class Scheduling {
        private String cron = "0 */30 * * * *";
        private boolean enabled = true;
        private boolean runOnStartup = false;
    }
}
