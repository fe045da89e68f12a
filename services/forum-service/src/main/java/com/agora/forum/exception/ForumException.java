package com.agora.forum.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for every failure the forum service reports to a caller.
 *
 * Each subclass fixes the HTTP status it maps to; the message is returned
 * verbatim in the {@code error} field of the response body, so it must never
 * contain secrets or reveal which credential check failed.
 *
 * @see GlobalExceptionHandler
 */
@Getter
public abstract class ForumException extends RuntimeException {

    private final HttpStatus status;

    protected ForumException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected ForumException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
