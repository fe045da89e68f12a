package com.agora.forum.exception;

import org.springframework.http.HttpStatus;

/**
 * Username or email already taken. Reported as a plain client error
 * (400, as the registration endpoint has always done) and never retried.
 */
public class ConflictException extends ForumException {

    public ConflictException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
