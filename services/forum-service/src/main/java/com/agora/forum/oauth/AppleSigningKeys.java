package com.agora.forum.oauth;

import com.agora.forum.exception.ProviderException;

import java.security.PublicKey;

/**
 * Source of Apple's identity-token signing keys, looked up by key id.
 */
public interface AppleSigningKeys {

    /**
     * @param keyId the {@code kid} header of the token being verified
     * @throws ProviderException if no key with that id is published
     */
    PublicKey publicKey(String keyId);
}
