package com.iptbrowser.feedsync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools for page fetching.
 *
 * The paginator pool bounds how many pages of one window are in flight. The page
 * fetch pool runs the HTTP exchange itself so the caller can give up at the request
 * deadline; it has a few spare threads for exchanges that are still draining after
 * their caller moved on.
 */
@Configuration
public class ExecutorConfig {

    public static final String PAGE_FETCH_EXECUTOR = "page-fetch-executor";
    public static final String PAGINATOR_EXECUTOR = "paginator-executor";

    @Bean(name = PAGE_FETCH_EXECUTOR)
    public ThreadPoolTaskExecutor pageFetchExecutor(FeedSyncProperties properties) {
        int workers = Math.max(1, properties.getPaging().getConcurrency()) + 1;
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers * 4);
        e.setQueueCapacity(0);
        e.setDaemon(true);
        e.setThreadNamePrefix("page-fetch-");
        e.initialize();
        return e;
    }

    @Bean(name = PAGINATOR_EXECUTOR)
    public ThreadPoolTaskExecutor paginatorExecutor(FeedSyncProperties properties) {
        int workers = Math.max(1, properties.getPaging().getConcurrency());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers);
        e.setDaemon(true);
        e.setThreadNamePrefix("paginate-");
        e.initialize();
        return e;
    }
}
