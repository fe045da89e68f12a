package com.agora.forum.controller;

import com.agora.forum.dto.VoteRequest;
import com.agora.forum.entity.VoteDirection;
import com.agora.forum.exception.ValidationException;

final class VoteRequests {

    static final String INVALID_VOTE_TYPE = "Vote type must be -1 or 1";

    private VoteRequests() {
    }

    static VoteDirection direction(VoteRequest request) {
        if (request == null || request.getVoteType() == null) {
            throw new ValidationException(INVALID_VOTE_TYPE);
        }
        try {
            return VoteDirection.fromValue(request.getVoteType());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(INVALID_VOTE_TYPE);
        }
    }
}
