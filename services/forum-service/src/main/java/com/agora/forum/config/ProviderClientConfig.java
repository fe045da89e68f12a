package com.agora.forum.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Beans shared by the identity flows: the HTTP client used to reach the
 * OAuth providers and the clock used for token timestamps.
 */
@Configuration
public class ProviderClientConfig {

    /**
     * RestTemplate for Google tokeninfo and Apple JWKS calls.
     *
     * Both timeouts are always set so a hung provider cannot hold a request
     * thread longer than connect + read timeout.
     */
    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder, OAuthProperties properties) {
        return builder
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
