package com.agora.forum.exception;

import org.springframework.http.HttpStatus;

/**
 * A write kept losing races on a unique constraint and the retry cap ran out.
 * The caller may simply try again.
 */
public class TransientConflictException extends ForumException {

    public TransientConflictException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
