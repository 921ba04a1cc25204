package com.example.faculty_collab_ingest.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * 访问 DBLP 使用的 RestTemplate
 */
@Configuration
public class RestTemplateConfig {

    @Value("${ingest.dblp.connect-timeout-ms:10000}")
    private long connectTimeoutMs;

    @Value("${ingest.dblp.read-timeout-ms:30000}")
    private long readTimeoutMs;

    @Bean
    public RestTemplate dblpRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .defaultHeader("User-Agent", "faculty-collab-ingest/0.0.1")
                .build();
    }
}
