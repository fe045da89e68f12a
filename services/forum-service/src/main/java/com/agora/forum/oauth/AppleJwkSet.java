package com.agora.forum.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON Web Key Set as served by https://appleid.apple.com/auth/keys.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppleJwkSet {

    private List<Key> keys = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Key {
        private String kty;
        private String kid;
        private String use;
        private String alg;
        /** RSA modulus, base64url. */
        private String n;
        /** RSA public exponent, base64url. */
        private String e;
    }
}
