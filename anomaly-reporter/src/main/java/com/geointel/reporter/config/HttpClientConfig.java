package com.geointel.reporter.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

/**
 * One RestTemplate for every outbound call, with bounded timeouts.
 * Non-2xx handling is left to each client.
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final ReporterProperties properties;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        ReporterProperties.Http http = properties.getHttp();
        return builder
                .setConnectTimeout(http.getConnectTimeout())
                .setReadTimeout(http.getReadTimeout())
                .defaultHeader(HttpHeaders.USER_AGENT, http.getUserAgent())
                .build();
    }
}
