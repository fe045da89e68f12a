package com.agora.forum.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Federated sign-in settings, bound from the {@code oauth.*} keys.
 */
@Data
@ConfigurationProperties(prefix = "oauth")
public class OAuthProperties {

    /** Connect timeout for every outbound provider call. */
    private Duration connectTimeout = Duration.ofSeconds(3);

    /** Read timeout for every outbound provider call. */
    private Duration readTimeout = Duration.ofSeconds(5);

    private Google google = new Google();

    private Apple apple = new Apple();

    @Data
    public static class Google {

        private String tokenInfoUrl = "https://oauth2.googleapis.com/tokeninfo";

        /**
         * Accepted {@code aud} values. Empty means the audience is not checked.
         */
        private List<String> clientIds = new ArrayList<>();
    }

    @Data
    public static class Apple {

        private String keysUrl = "https://appleid.apple.com/auth/keys";

        private String issuer = "https://appleid.apple.com";

        /**
         * Accepted {@code aud} values (the app's Services IDs / bundle IDs).
         * Apple tokens are rejected while this is empty.
         */
        private List<String> clientIds = new ArrayList<>();

        /** Minimum time between two JWKS downloads triggered by an unknown key id. */
        private Duration keyRefreshInterval = Duration.ofMinutes(1);

        private long clockSkewSeconds = 30;
    }
}
