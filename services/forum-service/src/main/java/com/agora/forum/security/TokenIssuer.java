package com.agora.forum.security;

import com.agora.forum.config.JwtProperties;
import com.agora.forum.entity.User;
import com.agora.forum.exception.AuthException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * TokenIssuer - creates and verifies the forum's session tokens.
 *
 * JWT Structure (RFC 7519, HMAC-SHA256):
 * - sub / user_id: numeric user id
 * - username, email: identity claims shown to the client
 * - iss: configured issuer, required on verify
 * - iat / exp: issuance and expiry (issuance + 72 hours by default)
 *
 * Tokens are stateless. There is no revocation list and no refresh flow;
 * logging out means the client discards its token.
 *
 * Clock skew: verification accepts a token up to {@code jwt.clock-skew-seconds}
 * (30 seconds by default) past its {@code exp}. Tokens older than that are
 * rejected with "Token expired".
 *
 * The signing key is built once in the constructor from the injected
 * configuration. A blank or short secret throws, which aborts application
 * startup instead of failing individual requests.
 *
 * @see JwtAuthenticationFilter for per-request verification
 */
@Component
public class TokenIssuer {

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_EMAIL = "email";

    private static final int MIN_SECRET_BYTES = 32;

    private final Key signingKey;
    private final String issuer;
    private final Duration lifetime;
    private final long clockSkewSeconds;
    private final Clock clock;

    public TokenIssuer(JwtProperties properties, Clock clock) {
        String secret = properties.getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret (JWT_SECRET) must be set");
        }
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        if (properties.getExpirationHours() <= 0) {
            throw new IllegalStateException("jwt.expiration-hours must be > 0");
        }
        if (properties.getClockSkewSeconds() < 0) {
            throw new IllegalStateException("jwt.clock-skew-seconds must be >= 0");
        }
        this.signingKey = Keys.hmacShaKeyFor(secretBytes);
        this.issuer = properties.getIssuer();
        this.lifetime = Duration.ofHours(properties.getExpirationHours());
        this.clockSkewSeconds = properties.getClockSkewSeconds();
        this.clock = clock;
    }

    /**
     * Claims for a freshly authenticated user, expiring one token lifetime from now.
     */
    public SessionClaims claimsFor(User user) {
        Instant expiresAt = clock.instant().plus(lifetime).truncatedTo(ChronoUnit.SECONDS);
        return new SessionClaims(UserId.of(user.getId()), user.getUsername(), user.getEmail(), expiresAt);
    }

    /**
     * Sign the given claims into a compact JWT.
     *
     * @param claims identity and expiry to embed
     * @return header.payload.signature
     */
    public String issue(SessionClaims claims) {
        long userId = claims.getUserId().getValue();
        return Jwts.builder()
                .setIssuer(issuer)
                .setSubject(Long.toString(userId))
                .claim(CLAIM_USER_ID, userId)
                .claim(CLAIM_USERNAME, claims.getUsername())
                .claim(CLAIM_EMAIL, claims.getEmail())
                .setIssuedAt(Date.from(clock.instant()))
                .setExpiration(Date.from(claims.getExpiresAt()))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Check signature, issuer and expiry, then read the claims back.
     *
     * @param token compact JWT without the "Bearer " prefix
     * @return the claims the token was issued with
     * @throws AuthException "Token expired" or "Invalid token"
     */
    public SessionClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException("Invalid token");
        }
        Claims claims;
        try {
            claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .requireIssuer(issuer)
                    .setAllowedClockSkewSeconds(clockSkewSeconds)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (ExpiredJwtException e) {
            throw new AuthException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException("Invalid token", e);
        }

        String username = claims.get(CLAIM_USERNAME, String.class);
        String email = claims.get(CLAIM_EMAIL, String.class);
        if (username == null || email == null || claims.getExpiration() == null) {
            throw new AuthException("Invalid token");
        }
        return new SessionClaims(parseUserId(claims.getSubject()), username, email,
                claims.getExpiration().toInstant());
    }

    private static UserId parseUserId(String subject) {
        try {
            return UserId.of(Long.parseLong(subject));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new AuthException("Invalid token", e);
        }
    }
}
