package com.agora.forum.repository;

import com.agora.forum.entity.Vote;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * VoteRepository - Data Access Layer for the voting ledger.
 *
 * The "for update" finders take a row lock on an existing vote so that a
 * toggle and a switch from the same user cannot interleave. When no row
 * exists there is nothing to lock; the unique constraints on
 * (user_id, post_id) and (user_id, comment_id) reject the losing insert.
 */
@Repository
public interface VoteRepository extends JpaRepository<Vote, Long> {

    /**
     * The voter's row on a post, locked until the surrounding transaction ends.
     *
     * Query: SELECT * FROM votes WHERE user_id = :userId AND post_id = :postId FOR UPDATE
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select v from Vote v where v.userId = :userId and v.postId = :postId")
    Optional<Vote> findPostVoteForUpdate(@Param("userId") Long userId, @Param("postId") Long postId);

    /**
     * Comment counterpart of {@link #findPostVoteForUpdate}.
     *
     * Query: SELECT * FROM votes WHERE user_id = :userId AND comment_id = :commentId FOR UPDATE
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select v from Vote v where v.userId = :userId and v.commentId = :commentId")
    Optional<Vote> findCommentVoteForUpdate(@Param("userId") Long userId, @Param("commentId") Long commentId);

    /**
     * Unlocked read of the voter's current vote on a post.
     *
     * Query: SELECT * FROM votes WHERE user_id = :userId AND post_id = :postId
     */
    Optional<Vote> findByUserIdAndPostId(Long userId, Long postId);

    /**
     * Query: SELECT * FROM votes WHERE user_id = :userId AND comment_id = :commentId
     */
    Optional<Vote> findByUserIdAndCommentId(Long userId, Long commentId);

    /**
     * Number of +1 or -1 rows on a post, served by idx_votes_post.
     *
     * Query: SELECT COUNT(*) FROM votes WHERE post_id = :postId AND vote_type = :voteType
     */
    long countByPostIdAndVoteType(Long postId, int voteType);

    /**
     * Query: SELECT COUNT(*) FROM votes WHERE comment_id = :commentId AND vote_type = :voteType
     */
    long countByCommentIdAndVoteType(Long commentId, int voteType);
}
