package com.agora.forum.exception;

import org.springframework.http.HttpStatus;

/**
 * An OAuth provider rejected a token, was unreachable, or answered with data
 * that could not be parsed.
 *
 * Thrown by the provider adapters only. The identity resolver logs it and
 * replaces it with an {@link AuthException} naming the provider, so callers
 * never see the upstream detail.
 */
public class ProviderException extends ForumException {

    public ProviderException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }

    public ProviderException(String message, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, message, cause);
    }
}
