package com.gridintel.ingest.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, IngestorProperties properties) {
        IngestorProperties.Http http = properties.getHttp();
        return builder
                .setConnectTimeout(http.getConnectTimeout())
                .setReadTimeout(http.getReadTimeout())
                .defaultHeader(HttpHeaders.USER_AGENT, http.getUserAgent())
                .build();
    }

    /** Wall clock for cursors and horizons; tests swap in a fixed one. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
