package com.agora.forum.entity;

import lombok.Value;

/**
 * What a vote is cast on: a post or a comment, by id.
 */
@Value
public class VoteTarget {

    public enum Kind {
        POST("Post"),
        COMMENT("Comment");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    Kind kind;
    long id;

    public static VoteTarget post(long postId) {
        return new VoteTarget(Kind.POST, postId);
    }

    public static VoteTarget comment(long commentId) {
        return new VoteTarget(Kind.COMMENT, commentId);
    }

    @Override
    public String toString() {
        return kind.getLabel().toLowerCase() + "#" + id;
    }
}
