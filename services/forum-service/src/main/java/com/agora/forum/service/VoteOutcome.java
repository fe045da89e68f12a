package com.agora.forum.service;

/**
 * What a cast did to the voter's row for the target.
 */
public enum VoteOutcome {

    /** No previous vote; a row was inserted. */
    RECORDED("Vote recorded"),
    /** Opposite previous vote; the row's direction was flipped. */
    UPDATED("Vote updated"),
    /** Same previous vote; the row was deleted. */
    REMOVED("Vote removed");

    private final String message;

    VoteOutcome(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
