package com.agora.forum.repository;

import com.agora.forum.entity.Comment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * CommentRepository - Data Access Layer for Comment entities.
 *
 * Used by the voting ledger to check that a comment exists before a vote
 * is cast on it:
 * - existsById -> SELECT COUNT(*) > 0 FROM comments WHERE id = ?
 */
@Repository
public interface CommentRepository extends JpaRepository<Comment, Long> {
}
