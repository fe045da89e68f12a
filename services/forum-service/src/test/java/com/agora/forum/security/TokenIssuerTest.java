package com.agora.forum.security;

import com.agora.forum.config.JwtProperties;
import com.agora.forum.entity.AuthProvider;
import com.agora.forum.entity.User;
import com.agora.forum.exception.AuthException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenIssuerTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";
    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30.250Z");

    private static JwtProperties properties(String secret) {
        JwtProperties properties = new JwtProperties();
        properties.setSecret(secret);
        properties.setIssuer("agora-forum");
        properties.setExpirationHours(72);
        properties.setClockSkewSeconds(30);
        return properties;
    }

    private static TokenIssuer issuerAt(Instant instant) {
        return new TokenIssuer(properties(SECRET), Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static User alice() {
        return User.builder()
                .id(7L)
                .username("alice")
                .email("a@x.com")
                .authProvider(AuthProvider.EMAIL)
                .build();
    }

    @Test
    void claimsFor_expiresSeventyTwoHoursAfterIssuance() {
        SessionClaims claims = issuerAt(NOW).claimsFor(alice());

        assertThat(claims.getUserId()).isEqualTo(UserId.of(7));
        assertThat(claims.getUsername()).isEqualTo("alice");
        assertThat(claims.getEmail()).isEqualTo("a@x.com");
        assertThat(claims.getExpiresAt()).isEqualTo(Instant.parse("2026-03-04T10:15:30Z"));
    }

    @Test
    void verify_returnsTheIssuedClaims() {
        TokenIssuer issuer = issuerAt(NOW);
        SessionClaims claims = issuer.claimsFor(alice());

        String token = issuer.issue(claims);

        assertThat(token.split("\\.")).hasSize(3);
        assertThat(issuer.verify(token)).isEqualTo(claims);
    }

    @Test
    void verify_acceptsTokenUntilExpiry() {
        SessionClaims claims = issuerAt(NOW).claimsFor(alice());
        String token = issuerAt(NOW).issue(claims);

        Instant justBeforeExpiry = claims.getExpiresAt().minusSeconds(1);

        assertThat(issuerAt(justBeforeExpiry).verify(token)).isEqualTo(claims);
    }

    @Test
    void verify_toleratesSkewJustPastExpiry() {
        SessionClaims claims = issuerAt(NOW).claimsFor(alice());
        String token = issuerAt(NOW).issue(claims);

        Instant withinSkew = claims.getExpiresAt().plusSeconds(10);

        assertThat(issuerAt(withinSkew).verify(token)).isEqualTo(claims);
    }

    @Test
    void verify_rejectsTokenPastExpiryAndSkew() {
        SessionClaims claims = issuerAt(NOW).claimsFor(alice());
        String token = issuerAt(NOW).issue(claims);

        TokenIssuer later = issuerAt(claims.getExpiresAt().plus(Duration.ofMinutes(2)));

        assertThatThrownBy(() -> later.verify(token))
                .isInstanceOf(AuthException.class)
                .hasMessage("Token expired");
    }

    @Test
    void verify_rejectsTokenSignedWithAnotherSecret() {
        TokenIssuer foreign = new TokenIssuer(properties("ffffffffffffffffffffffffffffffff"),
                Clock.fixed(NOW, ZoneOffset.UTC));
        String token = foreign.issue(foreign.claimsFor(alice()));

        assertThatThrownBy(() -> issuerAt(NOW).verify(token))
                .isInstanceOf(AuthException.class)
                .hasMessage("Invalid token");
    }

    @Test
    void verify_rejectsSwappedPayload() {
        TokenIssuer issuer = issuerAt(NOW);
        String aliceToken = issuer.issue(issuer.claimsFor(alice()));
        User mallory = User.builder().id(8L).username("mallory").email("m@x.com").build();
        String malloryToken = issuer.issue(issuer.claimsFor(mallory));

        String[] a = aliceToken.split("\\.");
        String[] m = malloryToken.split("\\.");
        String forged = a[0] + "." + m[1] + "." + a[2];

        assertThatThrownBy(() -> issuer.verify(forged)).isInstanceOf(AuthException.class);
    }

    @Test
    void verify_rejectsMalformedInput() {
        TokenIssuer issuer = issuerAt(NOW);

        assertThatThrownBy(() -> issuer.verify("not.a.jwt")).isInstanceOf(AuthException.class);
        assertThatThrownBy(() -> issuer.verify("garbage")).isInstanceOf(AuthException.class);
        assertThatThrownBy(() -> issuer.verify("")).isInstanceOf(AuthException.class);
        assertThatThrownBy(() -> issuer.verify(null)).isInstanceOf(AuthException.class);
    }

    @Test
    void constructor_refusesMissingOrShortSecret() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        assertThatThrownBy(() -> new TokenIssuer(properties(null), clock))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new TokenIssuer(properties("   "), clock))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new TokenIssuer(properties("too-short"), clock))
                .isInstanceOf(IllegalStateException.class);
    }
}
