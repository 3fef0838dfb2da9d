package com.iptbrowser.feedsync.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class HttpConfig {

    /**
     * Every page request gets a hard connect/read timeout; a timed out request
     * is reported as a failed page, never retried.
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, FeedSyncProperties properties) {
        return builder
                .setConnectTimeout(properties.getSource().getConnectTimeout())
                .setReadTimeout(properties.getSource().getReadTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
