package com.agora.forum.oauth;

import com.agora.forum.config.OAuthProperties;
import com.agora.forum.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.RSAPublicKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Downloads and caches Apple's published signing keys.
 *
 * Apple rotates keys without notice, so an unknown key id triggers a refetch.
 * Refetches are spaced at least {@code oauth.apple.key-refresh-interval}
 * apart; tokens naming a key id that is still unknown in between are rejected
 * without calling Apple again.
 */
@Slf4j
@Component
public class AppleJwksClient implements AppleSigningKeys {

    private final RestTemplate restTemplate;
    private final String keysUrl;
    private final Duration refreshInterval;
    private final Clock clock;

    private volatile Map<String, PublicKey> keysById = Map.of();
    private Instant lastFetch = Instant.EPOCH;

    public AppleJwksClient(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                           OAuthProperties properties,
                           Clock clock) {
        this.restTemplate = restTemplate;
        this.keysUrl = properties.getApple().getKeysUrl();
        this.refreshInterval = properties.getApple().getKeyRefreshInterval();
        this.clock = clock;
    }

    @Override
    public PublicKey publicKey(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            throw new ProviderException("apple token has no key id");
        }
        PublicKey key = keysById.get(keyId);
        if (key != null) {
            return key;
        }
        refreshIfDue();
        key = keysById.get(keyId);
        if (key == null) {
            throw new ProviderException("unknown apple signing key " + keyId);
        }
        return key;
    }

    private synchronized void refreshIfDue() {
        Instant now = clock.instant();
        if (!keysById.isEmpty() && now.isBefore(lastFetch.plus(refreshInterval))) {
            return;
        }
        lastFetch = now;

        AppleJwkSet jwkSet;
        try {
            jwkSet = restTemplate.getForObject(keysUrl, AppleJwkSet.class);
        } catch (RestClientException e) {
            throw new ProviderException("apple signing keys unavailable", e);
        }
        if (jwkSet == null || jwkSet.getKeys().isEmpty()) {
            throw new ProviderException("apple published no signing keys");
        }

        Map<String, PublicKey> fresh = new HashMap<>();
        for (AppleJwkSet.Key jwk : jwkSet.getKeys()) {
            if (!"RSA".equals(jwk.getKty()) || jwk.getKid() == null) {
                continue;
            }
            try {
                fresh.put(jwk.getKid(), toRsaKey(jwk));
            } catch (GeneralSecurityException | IllegalArgumentException e) {
                log.warn("Skipping unusable apple key {}: {}", jwk.getKid(), e.getMessage());
            }
        }
        keysById = Map.copyOf(fresh);
        log.info("Loaded {} apple signing keys", fresh.size());
    }

    static PublicKey toRsaKey(AppleJwkSet.Key jwk) throws GeneralSecurityException {
        Base64.Decoder decoder = Base64.getUrlDecoder();
        BigInteger modulus = new BigInteger(1, decoder.decode(jwk.getN()));
        BigInteger exponent = new BigInteger(1, decoder.decode(jwk.getE()));
        return KeyFactory.getInstance("RSA").generatePublic(new RSAPublicKeySpec(modulus, exponent));
    }
}
