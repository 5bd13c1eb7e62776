package com.whereq.triage.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient used by the health alert notifier
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_RESPONSE_BYTES = 256 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, "whereq-triage")
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            // webhook receivers only acknowledge
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_RESPONSE_BYTES));
    }
}
