package com.agora.forum.entity;

/**
 * Direction of a vote, stored as its signed value in {@code votes.vote_type}.
 */
public enum VoteDirection {

    UP(1),
    DOWN(-1);

    private final int value;

    VoteDirection(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * @throws IllegalArgumentException for anything other than 1 or -1
     */
    public static VoteDirection fromValue(int value) {
        if (value == 1) {
            return UP;
        }
        if (value == -1) {
            return DOWN;
        }
        throw new IllegalArgumentException("Vote type must be -1 or 1, got " + value);
    }
}
