package com.agora.forum.oauth;

import com.agora.forum.config.OAuthProperties;
import com.agora.forum.exception.ProviderException;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AppleJwksClientTest {

    private static final String KEYS_URL = "https://appleid.apple.com/auth/keys";
    private static final KeyPair KEY = Keys.keyPairFor(SignatureAlgorithm.RS256);

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private MutableClock clock;
    private AppleJwksClient client;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        OAuthProperties properties = new OAuthProperties();
        properties.getApple().setKeyRefreshInterval(Duration.ofMinutes(1));
        client = new AppleJwksClient(restTemplate, properties, clock);
    }

    private static String jwks(String kid) {
        RSAPublicKey publicKey = (RSAPublicKey) KEY.getPublic();
        return "{\"keys\":[{\"kty\":\"RSA\",\"kid\":\"" + kid + "\",\"use\":\"sig\",\"alg\":\"RS256\","
                + "\"n\":\"" + base64Url(publicKey.getModulus()) + "\","
                + "\"e\":\"" + base64Url(publicKey.getPublicExponent()) + "\"}]}";
    }

    private static String base64Url(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    @Test
    void publishedKey_isDecodedAndCached() {
        server.expect(ExpectedCount.once(), requestTo(KEYS_URL))
                .andRespond(withSuccess(jwks("k1"), MediaType.APPLICATION_JSON));

        RSAPublicKey first = (RSAPublicKey) client.publicKey("k1");
        RSAPublicKey second = (RSAPublicKey) client.publicKey("k1");

        assertThat(first.getModulus()).isEqualTo(((RSAPublicKey) KEY.getPublic()).getModulus());
        assertThat(second).isSameAs(first);
        server.verify();
    }

    @Test
    void unknownKeyId_refetchesAtMostOncePerInterval() {
        server.expect(ExpectedCount.once(), requestTo(KEYS_URL))
                .andRespond(withSuccess(jwks("k1"), MediaType.APPLICATION_JSON));
        server.expect(ExpectedCount.once(), requestTo(KEYS_URL))
                .andRespond(withSuccess(jwks("k2"), MediaType.APPLICATION_JSON));

        client.publicKey("k1");
        assertThatThrownBy(() -> client.publicKey("k2"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("k2");

        clock.advance(Duration.ofMinutes(2));

        assertThat(client.publicKey("k2")).isNotNull();
        server.verify();
    }

    @Test
    void unreachableKeyEndpoint_isProviderFailure() {
        server.expect(requestTo(KEYS_URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.publicKey("k1"))
                .isInstanceOf(ProviderException.class)
                .hasMessage("apple signing keys unavailable");
    }

    @Test
    void missingKeyId_isRejected() {
        assertThatThrownBy(() -> client.publicKey(null)).isInstanceOf(ProviderException.class);
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
