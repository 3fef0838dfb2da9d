package com.iptbrowser.feedsync;

import com.iptbrowser.feedsync.config.ExecutorConfig;
import com.iptbrowser.feedsync.config.RefreshController;
import com.iptbrowser.feedsync.fetch.ListingParser;
import com.iptbrowser.feedsync.service.RefreshOrchestrator;
import com.iptbrowser.feedsync.store.CacheStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "feed-sync.cache.file=target/test-cache/cache.json",
                "feed-sync.scheduling.enabled=false",
                "feed-sync.scheduling.run-on-startup=false"
        })
class FeedSyncApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    @DisplayName("application context wires the sync engine")
    void contextLoads() {
        assertThat(context.getBean(RefreshOrchestrator.class)).isNotNull();
        assertThat(context.getBean(CacheStore.class)).isNotNull();
        assertThat(context.getBean(ListingParser.class)).isNotNull();
        assertThat(context.getBean(RefreshController.class)).isNotNull();
    }

    @Test
    @DisplayName("page fetch pools are sized from the paging concurrency")
    void executorsSized() {
        ThreadPoolTaskExecutor paginator =
                context.getBean(ExecutorConfig.PAGINATOR_EXECUTOR, ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor pageFetch =
                context.getBean(ExecutorConfig.PAGE_FETCH_EXECUTOR, ThreadPoolTaskExecutor.class);

        assertThat(paginator.getMaxPoolSize()).isEqualTo(3);
        assertThat(pageFetch.getCorePoolSize()).isEqualTo(4);
        assertThat(pageFetch.getThreadNamePrefix()).isEqualTo("page-fetch-");
    }
}
