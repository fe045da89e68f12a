package com.agora.forum.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Vote - one user's stance on one post or one comment.
 *
 * Exactly one of post_id / comment_id is set. The two composite unique
 * constraints are what make "one vote per user per target" hold under
 * concurrent casts; the ledger relies on them rather than on a prior read.
 *
 * @see com.agora.forum.service.VoteLedger
 */
@Entity
@Table(name = "votes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_votes_user_post", columnNames = {"user_id", "post_id"}),
                @UniqueConstraint(name = "uk_votes_user_comment", columnNames = {"user_id", "comment_id"})
        },
        indexes = {
                @Index(name = "idx_votes_post", columnList = "post_id, vote_type"),
                @Index(name = "idx_votes_comment", columnList = "comment_id, vote_type")
        })
@Check(constraints = "(post_id IS NULL AND comment_id IS NOT NULL) OR (post_id IS NOT NULL AND comment_id IS NULL)")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class Vote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "post_id")
    private Long postId;

    @Column(name = "comment_id")
    private Long commentId;

    /** +1 or -1. */
    @Column(name = "vote_type", nullable = false)
    private int voteType;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * New vote row for a target, with exactly one foreign key populated.
     */
    public static Vote cast(long userId, VoteTarget target, VoteDirection direction) {
        Vote vote = new Vote();
        vote.setUserId(userId);
        if (target.getKind() == VoteTarget.Kind.POST) {
            vote.setPostId(target.getId());
        } else {
            vote.setCommentId(target.getId());
        }
        vote.setVoteType(direction.getValue());
        return vote;
    }

    public VoteDirection direction() {
        return VoteDirection.fromValue(voteType);
    }
}
