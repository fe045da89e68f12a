package com.agora.forum.service;

import lombok.Value;

/**
 * Up and down counts for one target, read straight from the vote rows.
 */
@Value
public class VoteTally {

    long upvotes;
    long downvotes;

    public long score() {
        return upvotes - downvotes;
    }
}
