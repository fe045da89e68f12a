package com.agora.forum.oauth;

import com.agora.forum.config.OAuthProperties;
import com.agora.forum.entity.AuthProvider;
import com.agora.forum.exception.ProviderException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SigningKeyResolverAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.Key;
import java.time.Clock;
import java.util.Date;
import java.util.List;

/**
 * Verifies "Sign in with Apple" identity tokens.
 *
 * Checks, in order:
 * - three dot-separated segments
 * - RS256 signature against Apple's published key for the token's {@code kid}
 * - issuer {@code https://appleid.apple.com}, expiry (with configured skew)
 * - audience among {@code oauth.apple.client-ids}
 *
 * Apple transmits {@code email_verified} and {@code is_private_email} as the
 * strings "true"/"false" (older tokens used booleans). Both forms are read
 * here so the quirk stays out of the user model.
 */
@Slf4j
@Component
public class AppleTokenVerifier implements ProviderVerifier {

    private final AppleSigningKeys signingKeys;
    private final String issuer;
    private final List<String> clientIds;
    private final long clockSkewSeconds;
    private final Clock clock;

    public AppleTokenVerifier(AppleSigningKeys signingKeys, OAuthProperties properties, Clock clock) {
        this.signingKeys = signingKeys;
        this.issuer = properties.getApple().getIssuer();
        this.clientIds = List.copyOf(properties.getApple().getClientIds());
        this.clockSkewSeconds = properties.getApple().getClockSkewSeconds();
        this.clock = clock;
        if (clientIds.isEmpty()) {
            log.warn("oauth.apple.client-ids is empty; every Apple sign-in will be rejected");
        }
    }

    @Override
    public AuthProvider provider() {
        return AuthProvider.APPLE;
    }

    @Override
    public ProviderIdentity verify(String token) {
        if (token == null || token.split("\\.", -1).length != 3) {
            throw new ProviderException("malformed apple token");
        }
        if (clientIds.isEmpty()) {
            throw new ProviderException("apple client ids not configured");
        }

        Claims claims;
        try {
            claims = Jwts.parserBuilder()
                    .setSigningKeyResolver(new SigningKeyResolverAdapter() {
                        @Override
                        public Key resolveSigningKey(JwsHeader header, Claims claims) {
                            return signingKeys.publicKey(header.getKeyId());
                        }
                    })
                    .requireIssuer(issuer)
                    .setAllowedClockSkewSeconds(clockSkewSeconds)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (JwtException | IllegalArgumentException e) {
            throw new ProviderException("invalid apple token: " + e.getMessage(), e);
        }

        if (!clientIds.contains(claims.getAudience())) {
            throw new ProviderException("apple token issued for another audience");
        }

        String subject = claims.getSubject();
        String email = claims.get("email", String.class);
        if (subject == null || subject.isBlank() || email == null || email.isBlank()) {
            throw new ProviderException("apple token missing subject or email");
        }

        // Absent means Apple did not say; only an explicit "false" is a rejection.
        Object emailVerified = claims.get("email_verified");
        if (emailVerified != null && !flag(emailVerified)) {
            throw new ProviderException("email not verified");
        }
        if (flag(claims.get("is_private_email"))) {
            log.debug("Apple subject {} signed in with a private relay address", subject);
        }

        return ProviderIdentity.builder()
                .subjectId(subject)
                .email(email)
                .emailVerified(true)
                .build();
    }

    private static boolean flag(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }
}
