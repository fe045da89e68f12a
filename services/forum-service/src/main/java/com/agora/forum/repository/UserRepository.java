package com.agora.forum.repository;

import com.agora.forum.entity.AuthProvider;
import com.agora.forum.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * UserRepository - Data Access Layer for User entities.
 *
 * Besides the derived lookups, this repository exposes conditional updates
 * for account linking. Each one only writes when the target column is still
 * empty, which makes concurrent linking of the same identity idempotent:
 * the second writer matches zero rows instead of overwriting.
 *
 * @see User for entity definition
 * @see com.agora.forum.service.IdentityResolver for the flows using it
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find an account by (normalized) email, whatever provider created it.
     *
     * Query: SELECT * FROM users WHERE email = :email
     *
     * @param email trimmed, lower-cased email
     * @return the account, or empty
     */
    Optional<User> findByEmail(String email);

    /**
     * Local-credential lookup. Accounts created through Google or Apple never
     * match, even when they share the email.
     *
     * Query: SELECT * FROM users WHERE email = :email AND auth_provider = :authProvider
     */
    Optional<User> findByEmailAndAuthProvider(String email, AuthProvider authProvider);

    /**
     * Find the account a Google identity is linked to.
     *
     * Query: SELECT * FROM users WHERE google_subject_id = :googleSubjectId
     */
    Optional<User> findByGoogleSubjectId(String googleSubjectId);

    /**
     * Find the account an Apple identity is linked to.
     *
     * Query: SELECT * FROM users WHERE apple_subject_id = :appleSubjectId
     */
    Optional<User> findByAppleSubjectId(String appleSubjectId);

    /**
     * Availability check used by the username allocator.
     *
     * Query: SELECT COUNT(*) > 0 FROM users WHERE username = :username
     */
    boolean existsByUsername(String username);

    /**
     * Pre-check for registration. The unique constraints still decide when
     * two registrations race.
     *
     * Query: SELECT COUNT(*) > 0 FROM users WHERE username = :username OR email = :email
     */
    boolean existsByUsernameOrEmail(String username, String email);

    /**
     * Attach a Google subject id to an account that has none yet.
     *
     * @return number of rows written (0 when already linked)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update User u set u.googleSubjectId = :subjectId, u.updatedAt = :now "
            + "where u.id = :id and u.googleSubjectId is null")
    int linkGoogleSubject(@Param("id") Long id,
                          @Param("subjectId") String subjectId,
                          @Param("now") LocalDateTime now);

    /**
     * Attach an Apple subject id to an account that has none yet.
     *
     * @return number of rows written (0 when already linked)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update User u set u.appleSubjectId = :subjectId, u.updatedAt = :now "
            + "where u.id = :id and u.appleSubjectId is null")
    int linkAppleSubject(@Param("id") Long id,
                         @Param("subjectId") String subjectId,
                         @Param("now") LocalDateTime now);

    /**
     * Set the avatar only when the account has none.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update User u set u.avatar = :avatar, u.updatedAt = :now "
            + "where u.id = :id and (u.avatar is null or u.avatar = '')")
    int fillAvatarIfEmpty(@Param("id") Long id,
                          @Param("avatar") String avatar,
                          @Param("now") LocalDateTime now);
}
