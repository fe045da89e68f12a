package com.agora.forum.exception;

import org.springframework.http.HttpStatus;

/**
 * Invalid credentials, an invalid or expired session token, or a rejected
 * provider token.
 */
public class AuthException extends ForumException {

    public AuthException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }

    public AuthException(String message, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, message, cause);
    }
}
