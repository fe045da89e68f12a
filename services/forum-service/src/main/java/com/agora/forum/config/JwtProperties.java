package com.agora.forum.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Session token settings, bound from the {@code jwt.*} keys.
 *
 * <p>The secret has no default. The token issuer refuses to start without
 * one, so a missing {@code JWT_SECRET} fails the deployment rather than the
 * first login.</p>
 */
@Data
@ConfigurationProperties(prefix = "jwt")
public class JwtProperties {

    /**
     * HMAC-SHA256 signing key. At least 32 bytes once UTF-8 encoded.
     */
    private String secret;

    /**
     * Value of the {@code iss} claim, checked on verify.
     */
    private String issuer = "agora-forum";

    /**
     * Session lifetime in hours.
     */
    private long expirationHours = 72;

    /**
     * Tolerance applied to {@code exp}/{@code iat} when verifying, in seconds.
     */
    private long clockSkewSeconds = 30;
}
