package com.agora.forum.oauth;

import com.agora.forum.entity.AuthProvider;
import com.agora.forum.exception.ProviderException;

/**
 * Exchanges an opaque provider token for a verified identity.
 *
 * Implementations must bound every network call and must reject tokens whose
 * email the provider has not verified.
 */
public interface ProviderVerifier {

    /**
     * The federated provider this verifier speaks for.
     */
    AuthProvider provider();

    /**
     * @param token token handed to the client by the provider
     * @return subject, email and verification flag
     * @throws ProviderException if the token is rejected, malformed, or the
     *                           provider cannot be reached
     */
    ProviderIdentity verify(String token);
}
