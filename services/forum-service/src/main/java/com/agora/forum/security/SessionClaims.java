package com.agora.forum.security;

import lombok.Value;

import java.time.Instant;

/**
 * Identity facts carried inside a session token. Never persisted.
 */
@Value
public class SessionClaims {

    UserId userId;
    String username;
    String email;

    /** Whole seconds, as encoded in the token's {@code exp} claim. */
    Instant expiresAt;
}
