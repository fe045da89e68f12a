package com.agora.forum.exception;

import org.springframework.http.HttpStatus;

/**
 * Malformed or missing input. Never logged as a server fault.
 */
public class ValidationException extends ForumException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
