package com.agora.forum.security;

import lombok.Value;

/**
 * Numeric id of an authenticated user.
 *
 * Produced once by the token filter and passed explicitly to every service
 * call that acts on behalf of the caller. It is also the Spring Security
 * principal, so controllers receive it through {@code @AuthenticationPrincipal}.
 */
@Value
public class UserId {

    long value;

    public static UserId of(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("user id must be positive: " + value);
        }
        return new UserId(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
