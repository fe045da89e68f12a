package com.agora.forum.exception;

import org.springframework.http.HttpStatus;

/**
 * A referenced user, post or comment does not exist. Rendered as 404.
 */
public class NotFoundException extends ForumException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
