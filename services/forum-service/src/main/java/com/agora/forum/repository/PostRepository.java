package com.agora.forum.repository;

import com.agora.forum.entity.Post;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * PostRepository - Data Access Layer for Post entities.
 *
 * The voting ledger only needs {@code existsById} from the inherited
 * JpaRepository methods, to reject votes on posts that do not exist:
 * - existsById -> SELECT COUNT(*) > 0 FROM posts WHERE id = ?
 *
 * @see com.agora.forum.service.VoteLedger
 */
@Repository
public interface PostRepository extends JpaRepository<Post, Long> {
}
