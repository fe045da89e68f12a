package com.agora.forum.oauth;

import com.agora.forum.config.OAuthProperties;
import com.agora.forum.exception.ProviderException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppleTokenVerifierTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String ISSUER = "https://appleid.apple.com";
    private static final String CLIENT_ID = "com.agora.forum.web";

    private static final KeyPair APPLE_KEY = Keys.keyPairFor(SignatureAlgorithm.RS256);
    private static final KeyPair OTHER_KEY = Keys.keyPairFor(SignatureAlgorithm.RS256);

    private OAuthProperties properties;
    private AppleSigningKeys signingKeys;

    @BeforeEach
    void setUp() {
        properties = new OAuthProperties();
        properties.getApple().setClientIds(List.of(CLIENT_ID));
        Map<String, PublicKey> published = Map.of("k1", APPLE_KEY.getPublic());
        signingKeys = keyId -> {
            PublicKey key = published.get(keyId);
            if (key == null) {
                throw new ProviderException("unknown apple signing key " + keyId);
            }
            return key;
        };
    }

    private AppleTokenVerifier verifier() {
        return new AppleTokenVerifier(signingKeys, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static JwtBuilder validToken() {
        return Jwts.builder()
                .setHeaderParam("kid", "k1")
                .setIssuer(ISSUER)
                .setAudience(CLIENT_ID)
                .setSubject("001234.abcd")
                .claim("email", "erin@privaterelay.appleid.com")
                .claim("email_verified", "true")
                .claim("is_private_email", "true")
                .setIssuedAt(Date.from(NOW.minusSeconds(60)))
                .setExpiration(Date.from(NOW.plus(Duration.ofMinutes(10))));
    }

    private static String sign(JwtBuilder builder, KeyPair keyPair) {
        return builder.signWith(keyPair.getPrivate(), SignatureAlgorithm.RS256).compact();
    }

    @Test
    void validToken_yieldsIdentityWithoutPicture() {
        ProviderIdentity identity = verifier().verify(sign(validToken(), APPLE_KEY));

        assertThat(identity.getSubjectId()).isEqualTo("001234.abcd");
        assertThat(identity.getEmail()).isEqualTo("erin@privaterelay.appleid.com");
        assertThat(identity.isEmailVerified()).isTrue();
        assertThat(identity.getPictureUrl()).isNull();
    }

    @Test
    void booleanEmailVerifiedClaim_isAccepted() {
        String token = sign(validToken().claim("email_verified", true), APPLE_KEY);

        assertThat(verifier().verify(token).getSubjectId()).isEqualTo("001234.abcd");
    }

    @Test
    void explicitlyUnverifiedEmail_isRejected() {
        String token = sign(validToken().claim("email_verified", "false"), APPLE_KEY);

        assertThatThrownBy(() -> verifier().verify(token))
                .isInstanceOf(ProviderException.class)
                .hasMessage("email not verified");
    }

    @Test
    void wrongAudience_isRejected() {
        String token = sign(validToken().setAudience("com.example.other"), APPLE_KEY);

        assertThatThrownBy(() -> verifier().verify(token))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("audience");
    }

    @Test
    void wrongIssuer_isRejected() {
        String token = sign(validToken().setIssuer("https://evil.example"), APPLE_KEY);

        assertThatThrownBy(() -> verifier().verify(token)).isInstanceOf(ProviderException.class);
    }

    @Test
    void expiredToken_isRejected() {
        String token = sign(validToken().setExpiration(Date.from(NOW.minus(Duration.ofMinutes(5)))), APPLE_KEY);

        assertThatThrownBy(() -> verifier().verify(token)).isInstanceOf(ProviderException.class);
    }

    @Test
    void tokenSignedByAnotherKey_isRejected() {
        String token = sign(validToken(), OTHER_KEY);

        assertThatThrownBy(() -> verifier().verify(token)).isInstanceOf(ProviderException.class);
    }

    @Test
    void unknownKeyId_isRejected() {
        String token = sign(validToken().setHeaderParam("kid", "rotated"), APPLE_KEY);

        assertThatThrownBy(() -> verifier().verify(token))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("rotated");
    }

    @Test
    void missingEmail_isRejected() {
        String token = sign(Jwts.builder()
                .setHeaderParam("kid", "k1")
                .setIssuer(ISSUER)
                .setAudience(CLIENT_ID)
                .setSubject("001234.abcd")
                .setExpiration(Date.from(NOW.plus(Duration.ofMinutes(10)))), APPLE_KEY);

        assertThatThrownBy(() -> verifier().verify(token)).isInstanceOf(ProviderException.class);
    }

    @Test
    void malformedToken_isRejected() {
        assertThatThrownBy(() -> verifier().verify("only.two"))
                .isInstanceOf(ProviderException.class)
                .hasMessage("malformed apple token");
        assertThatThrownBy(() -> verifier().verify(null)).isInstanceOf(ProviderException.class);
    }

    @Test
    void noConfiguredClientIds_rejectsEverything() {
        properties.getApple().setClientIds(List.of());

        assertThatThrownBy(() -> verifier().verify(sign(validToken(), APPLE_KEY)))
                .isInstanceOf(ProviderException.class);
    }
}
