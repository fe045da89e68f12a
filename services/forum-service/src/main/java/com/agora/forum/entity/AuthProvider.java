package com.agora.forum.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an account was originally created. Stored and serialised in lower case
 * ({@code email}, {@code google}, {@code apple}).
 *
 * An account keeps its provider for life, even after a federated identity
 * is linked onto it.
 */
public enum AuthProvider {

    EMAIL("email", "Email"),
    GOOGLE("google", "Google"),
    APPLE("apple", "Apple");

    private final String code;
    private final String displayName;

    AuthProvider(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static AuthProvider fromCode(String code) {
        for (AuthProvider provider : values()) {
            if (provider.code.equals(code)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown auth provider: " + code);
    }
}
