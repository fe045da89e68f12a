package com.agora.forum.service;

import com.agora.forum.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Picks usernames for accounts created through Google or Apple.
 *
 * The existence check below is only a fast path. Two sign-ins can both see "bob" as
 * free; the unique index on users.username decides, and the loser calls
 * {@link #allocateUnique} again once the winner's row is visible.
 */
@Component
@RequiredArgsConstructor
public class UsernameAllocator {

    static final String FALLBACK_CANDIDATE = "user";

    /** Length of the users.username column. */
    static final int MAX_USERNAME_LENGTH = 50;

    private final UserRepository userRepository;

    /**
     * The part of the email before the first '@', or the whole string when
     * there is none.
     */
    public String deriveCandidate(String email) {
        if (email == null) {
            return FALLBACK_CANDIDATE;
        }
        int at = email.indexOf('@');
        return at >= 0 ? email.substring(0, at) : email;
    }

    /**
     * Returns {@code candidate} if nobody holds it, otherwise the first free
     * name among candidate1, candidate2, ...
     *
     * A suffixed name that would overflow the username column drops characters
     * from the end of the candidate, never from the suffix.
     *
     * Each taken name checked belongs to a distinct existing user, so the loop
     * ends after at most (number of users + 1) lookups.
     */
    public String allocateUnique(String candidate) {
        String base = sanitize(candidate);
        if (!userRepository.existsByUsername(base)) {
            return base;
        }
        long suffix = 1;
        while (true) {
            String attempt = withSuffix(base, suffix);
            if (!userRepository.existsByUsername(attempt)) {
                return attempt;
            }
            suffix++;
        }
    }

    private static String sanitize(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return FALLBACK_CANDIDATE;
        }
        String trimmed = candidate.trim();
        return trimmed.length() > MAX_USERNAME_LENGTH ? trimmed.substring(0, MAX_USERNAME_LENGTH) : trimmed;
    }

    private static String withSuffix(String base, long suffix) {
        String digits = Long.toString(suffix);
        int room = MAX_USERNAME_LENGTH - digits.length();
        return (base.length() > room ? base.substring(0, room) : base) + digits;
    }
}
