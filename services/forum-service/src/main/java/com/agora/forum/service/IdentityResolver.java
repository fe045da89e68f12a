package com.agora.forum.service;

import com.agora.forum.config.RetryProperties;
import com.agora.forum.entity.AuthProvider;
import com.agora.forum.entity.User;
import com.agora.forum.exception.AuthException;
import com.agora.forum.exception.ConflictException;
import com.agora.forum.exception.NotFoundException;
import com.agora.forum.exception.ProviderException;
import com.agora.forum.exception.TransientConflictException;
import com.agora.forum.exception.ValidationException;
import com.agora.forum.oauth.ProviderIdentity;
import com.agora.forum.oauth.ProviderVerifier;
import com.agora.forum.repository.UserRepository;
import com.agora.forum.security.PasswordHasher;
import com.agora.forum.security.SessionClaims;
import com.agora.forum.security.TokenIssuer;
import com.agora.forum.security.UserId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * IdentityResolver - turns credentials or provider tokens into a User and a session.
 *
 * Flows:
 * - register: create a local account (username and email must both be free)
 * - login: email + password against local accounts only
 * - oauthLogin: verify a Google/Apple token, then create, link or reuse an account
 * - currentUser: load the account behind an authenticated request
 *
 * Concurrency:
 * No flow holds a database transaction across a password hash or a provider
 * call. Writes run in short TransactionTemplate units and rely on the unique
 * constraints on users for correctness. A federated sign-in that loses an
 * insert race re-reads and tries again (up to {@code forum.retry.identity-max-attempts}),
 * which turns a lost username race into the next suffix and a lost email race
 * into a plain login of the account the other request created.
 *
 * Emails are trimmed and lower-cased before they are stored or looked up.
 *
 * @see UsernameAllocator for username selection
 * @see TokenIssuer for session tokens
 */
@Slf4j
@Service
public class IdentityResolver {

    private static final String INVALID_CREDENTIALS = "Invalid credentials";
    private static final String DUPLICATE_ACCOUNT = "Username or email already exists";
    private static final String PASSWORD_TOO_LONG =
            "password must be at most " + PasswordHasher.MAX_PASSWORD_BYTES + " bytes";

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final TokenIssuer tokenIssuer;
    private final UsernameAllocator usernameAllocator;
    private final List<ProviderVerifier> providerVerifiers;
    private final TransactionTemplate transactionTemplate;
    private final RetryProperties retryProperties;
    private final Clock clock;

    public IdentityResolver(UserRepository userRepository,
                            PasswordHasher passwordHasher,
                            TokenIssuer tokenIssuer,
                            UsernameAllocator usernameAllocator,
                            List<ProviderVerifier> providerVerifiers,
                            TransactionTemplate transactionTemplate,
                            RetryProperties retryProperties,
                            Clock clock) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.tokenIssuer = tokenIssuer;
        this.usernameAllocator = usernameAllocator;
        this.providerVerifiers = List.copyOf(providerVerifiers);
        this.transactionTemplate = transactionTemplate;
        this.retryProperties = retryProperties;
        this.clock = clock;
    }

    /**
     * Create a local account and sign it in.
     *
     * @throws ValidationException if the password is longer than BCrypt can hash
     * @throws ConflictException if the username or the email is taken, including
     *                           when a concurrent registration takes it first
     */
    public AuthResult register(String username, String email, String password, String avatar) {
        if (password != null && !PasswordHasher.fitsBcrypt(password)) {
            throw new ValidationException(PASSWORD_TOO_LONG);
        }
        String normalizedUsername = username.trim();
        String normalizedEmail = normalizeEmail(email);
        log.info("Registration attempt for username: {}", normalizedUsername);

        if (userRepository.existsByUsernameOrEmail(normalizedUsername, normalizedEmail)) {
            throw new ConflictException(DUPLICATE_ACCOUNT);
        }

        // Hash before opening a transaction; BCrypt is slow on purpose
        String digest = passwordHasher.hash(password);
        User candidate = User.builder()
                .username(normalizedUsername)
                .email(normalizedEmail)
                .passwordHash(digest)
                .avatar(emptyIfBlank(avatar))
                .authProvider(AuthProvider.EMAIL)
                .build();

        User created;
        try {
            created = transactionTemplate.execute(status -> userRepository.saveAndFlush(candidate));
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(DUPLICATE_ACCOUNT);
        }
        log.info("Created local account {} ({})", created.getId(), created.getUsername());
        return authenticated(created, AuthResult.Outcome.NEW_LOCAL_ACCOUNT);
    }

    /**
     * Email/password login. Every failure, unknown email or wrong password,
     * produces the same "Invalid credentials" error.
     */
    public AuthResult login(String email, String password) {
        Optional<User> found = userRepository.findByEmailAndAuthProvider(normalizeEmail(email), AuthProvider.EMAIL);
        if (found.isEmpty()) {
            passwordHasher.verifyDecoy(password);
            throw new AuthException(INVALID_CREDENTIALS);
        }
        User user = found.get();
        if (!passwordHasher.verify(password, user.getPasswordHash())) {
            throw new AuthException(INVALID_CREDENTIALS);
        }
        log.info("User {} logged in", user.getId());
        return authenticated(user, AuthResult.Outcome.EXISTING_LOCAL_LOGIN);
    }

    /**
     * Sign in through Google or Apple.
     *
     * The account is looked up by email first and by provider subject id
     * second; the first match wins. Then:
     * - no match: create an account (requested username, or one derived from
     *   the email, made unique; avatar from the request, else the provider's
     *   picture)
     * - match without this provider's subject id: link it onto the account
     * - match without an avatar while the request carries one: fill it in
     *
     * @param provider GOOGLE or APPLE
     * @param token provider token from the client
     * @param requestedUsername optional username for a new account
     * @param requestedAvatar optional avatar
     * @throws AuthException "Invalid Google token" / "Invalid Apple token" when
     *                       verification fails; nothing is written in that case
     */
    public AuthResult oauthLogin(AuthProvider provider, String token, String requestedUsername, String requestedAvatar) {
        ProviderIdentity identity = verifyWithProvider(provider, token);
        String email = normalizeEmail(identity.getEmail());

        int maxAttempts = Math.max(1, retryProperties.getIdentityMaxAttempts());
        DataIntegrityViolationException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<User> match = findFederatedMatch(provider, email, identity.getSubjectId());
            if (match.isPresent()) {
                User resolved = linkExisting(match.get(), provider, identity.getSubjectId(), requestedAvatar);
                return authenticated(resolved, AuthResult.Outcome.LINKED_FEDERATED_ACCOUNT);
            }
            try {
                User created = createFederated(provider, identity, email, requestedUsername, requestedAvatar);
                return authenticated(created, AuthResult.Outcome.NEW_FEDERATED_ACCOUNT);
            } catch (DataIntegrityViolationException e) {
                log.info("{} sign-in lost an insert race (attempt {}/{}), re-resolving",
                        provider.getDisplayName(), attempt, maxAttempts);
                lastConflict = e;
            }
        }
        throw new TransientConflictException("Sign-in could not be completed, please retry", lastConflict);
    }

    /**
     * @throws NotFoundException if the account was deleted after the token was issued
     */
    public User currentUser(UserId userId) {
        return userRepository.findById(userId.getValue())
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    private ProviderIdentity verifyWithProvider(AuthProvider provider, String token) {
        ProviderVerifier verifier = providerVerifiers.stream()
                .filter(v -> v.provider() == provider)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No verifier for provider " + provider));
        try {
            return verifier.verify(token);
        } catch (ProviderException e) {
            log.warn("{} token verification failed: {}", provider.getDisplayName(), e.getMessage());
            throw new AuthException("Invalid " + provider.getDisplayName() + " token");
        }
    }

    private Optional<User> findFederatedMatch(AuthProvider provider, String email, String subjectId) {
        Optional<User> byEmail = userRepository.findByEmail(email);
        if (byEmail.isPresent()) {
            return byEmail;
        }
        return findBySubject(provider, subjectId);
    }

    private Optional<User> findBySubject(AuthProvider provider, String subjectId) {
        switch (provider) {
            case GOOGLE:
                return userRepository.findByGoogleSubjectId(subjectId);
            case APPLE:
                return userRepository.findByAppleSubjectId(subjectId);
            default:
                throw new IllegalArgumentException("Not a federated provider: " + provider);
        }
    }

    private User createFederated(AuthProvider provider,
                                 ProviderIdentity identity,
                                 String email,
                                 String requestedUsername,
                                 String requestedAvatar) {
        String base = isBlank(requestedUsername) ? usernameAllocator.deriveCandidate(email) : requestedUsername;
        String username = usernameAllocator.allocateUnique(base);

        String avatar = !isBlank(requestedAvatar) ? requestedAvatar.trim() : emptyIfBlank(identity.getPictureUrl());

        User.UserBuilder builder = User.builder()
                .username(username)
                .email(email)
                .passwordHash("")
                .avatar(avatar)
                .authProvider(provider);
        if (provider == AuthProvider.GOOGLE) {
            builder.googleSubjectId(identity.getSubjectId());
        } else {
            builder.appleSubjectId(identity.getSubjectId());
        }
        User candidate = builder.build();

        User created = transactionTemplate.execute(status -> userRepository.saveAndFlush(candidate));
        log.info("Created {} account {} ({})", provider.getDisplayName(), created.getId(), created.getUsername());
        return created;
    }

    /**
     * Both writes are conditional updates: they only touch empty columns, so
     * two concurrent sign-ins for the same account write at most once each.
     */
    private User linkExisting(User user, AuthProvider provider, String subjectId, String requestedAvatar) {
        Long userId = user.getId();
        LocalDateTime now = LocalDateTime.now(clock);

        String currentSubject = user.subjectIdFor(provider);
        if (currentSubject == null) {
            linkSubject(userId, provider, subjectId, now);
        } else if (!currentSubject.equals(subjectId)) {
            log.warn("User {} matched by email is linked to a different {} subject; signing in without relinking",
                    userId, provider.getDisplayName());
        }

        if (!isBlank(requestedAvatar) && !user.hasAvatar()) {
            String avatar = requestedAvatar.trim();
            transactionTemplate.execute(status -> userRepository.fillAvatarIfEmpty(userId, avatar, now));
        }

        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    private void linkSubject(Long userId, AuthProvider provider, String subjectId, LocalDateTime now) {
        Optional<User> holder = findBySubject(provider, subjectId);
        if (holder.isPresent() && !holder.get().getId().equals(userId)) {
            log.warn("{} subject already belongs to user {}; not linking it to user {}",
                    provider.getDisplayName(), holder.get().getId(), userId);
            return;
        }
        try {
            Integer rows = transactionTemplate.execute(status -> provider == AuthProvider.GOOGLE
                    ? userRepository.linkGoogleSubject(userId, subjectId, now)
                    : userRepository.linkAppleSubject(userId, subjectId, now));
            if (rows != null && rows > 0) {
                log.info("Linked {} identity to existing user {}", provider.getDisplayName(), userId);
            }
        } catch (DataIntegrityViolationException e) {
            // Another request linked the same subject to a different account first
            log.warn("{} subject was linked elsewhere concurrently; user {} left unlinked",
                    provider.getDisplayName(), userId);
        }
    }

    private AuthResult authenticated(User user, AuthResult.Outcome outcome) {
        SessionClaims claims = tokenIssuer.claimsFor(user);
        return new AuthResult(user, tokenIssuer.issue(claims), outcome);
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String emptyIfBlank(String value) {
        return isBlank(value) ? "" : value.trim();
    }
}
