package com.agora.forum.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * User - JPA Entity representing a forum account.
 *
 * Maps to the 'users' table. Every uniqueness rule lives in the schema, not
 * in application checks, because registrations and federated logins race:
 * - username: unique at all times
 * - email: unique at all times
 * - google_subject_id / apple_subject_id: unique when present (NULL when absent)
 *
 * Credential paths:
 * - authProvider = EMAIL: passwordHash holds a BCrypt digest
 * - authProvider = GOOGLE / APPLE: passwordHash is empty and the matching
 *   subject id is set at creation
 * A record may later pick up a second provider's subject id (account linking)
 * without its authProvider or username changing.
 *
 * @see com.agora.forum.repository.UserRepository for database operations
 * @see com.agora.forum.service.IdentityResolver for creation and linking
 */
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uk_users_username", columnNames = "username"),
        @UniqueConstraint(name = "uk_users_email", columnNames = "email"),
        @UniqueConstraint(name = "uk_users_google_subject", columnNames = "google_subject_id"),
        @UniqueConstraint(name = "uk_users_apple_subject", columnNames = "apple_subject_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "passwordHash")
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "username", nullable = false, length = 50)
    private String username;

    @Column(name = "email", nullable = false, length = 255)
    private String email;

    /**
     * BCrypt digest for local accounts, empty string for OAuth-only accounts.
     */
    @Builder.Default
    @Column(name = "password_hash", nullable = false)
    private String passwordHash = "";

    @Builder.Default
    @Column(name = "bio", nullable = false, length = 1000)
    private String bio = "";

    /**
     * Either a preset avatar number ("1" to "6") or an image URL. Empty when unset.
     */
    @Builder.Default
    @Column(name = "avatar", nullable = false, length = 1024)
    private String avatar = "";

    @Column(name = "auth_provider", nullable = false, length = 16)
    private AuthProvider authProvider;

    @Column(name = "google_subject_id")
    private String googleSubjectId;

    @Column(name = "apple_subject_id")
    private String appleSubjectId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Subject id this account holds for the given federated provider, or null.
     */
    public String subjectIdFor(AuthProvider provider) {
        switch (provider) {
            case GOOGLE:
                return googleSubjectId;
            case APPLE:
                return appleSubjectId;
            default:
                return null;
        }
    }

    public boolean hasAvatar() {
        return avatar != null && !avatar.isEmpty();
    }
}
