package com.agora.forum.controller;

import com.agora.forum.dto.AuthResponse;
import com.agora.forum.dto.LoginRequest;
import com.agora.forum.dto.OAuthLoginRequest;
import com.agora.forum.dto.RegisterRequest;
import com.agora.forum.dto.UserResponse;
import com.agora.forum.entity.AuthProvider;
import com.agora.forum.security.UserId;
import com.agora.forum.service.AuthResult;
import com.agora.forum.service.IdentityResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * AuthController - REST API endpoints for identity operations.
 *
 * Endpoints:
 * - POST /api/register     - create a local account, 201 with token
 * - POST /api/login        - email/password login, 401 on any mismatch
 * - POST /api/auth/google  - Google sign-in (create, link or reuse account)
 * - POST /api/auth/apple   - Apple sign-in (create, link or reuse account)
 * - GET  /api/me           - the authenticated caller's account
 *
 * There is no logout endpoint: sessions are stateless JWTs and the client
 * logs out by discarding its token.
 *
 * @see IdentityResolver for the business logic
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AuthController {

    /** Resolves credentials and provider tokens into accounts and sessions */
    private final IdentityResolver identityResolver;

    /**
     * Create a local account and sign it in.
     *
     * @param request username, email, password (6 to 72 characters, at most 72 bytes) and optional avatar
     * @return 201 with "User registered successfully", the token and the new user;
     *         400 on invalid input or when the username or email is taken
     */
    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        AuthResult result = identityResolver.register(
                request.getUsername(), request.getEmail(), request.getPassword(), request.getAvatar());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(toResponse("User registered successfully", result));
    }

    /**
     * Email/password login for accounts created by registration.
     *
     * @return 200 with "Login successful", the token and the user;
     *         401 "Invalid credentials" for an unknown email or a wrong password alike
     */
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        AuthResult result = identityResolver.login(request.getEmail(), request.getPassword());
        return ResponseEntity.ok(toResponse("Login successful", result));
    }

    /**
     * Sign in with a Google ID token.
     *
     * Flow:
     * 1. The token is checked against Google's tokeninfo endpoint
     * 2. An account with the same email (or Google subject) is reused and linked
     * 3. Otherwise a new account is created, named after the email's local part
     *    unless the request supplies a username
     *
     * @return 200 with the token and user; 401 "Invalid Google token" when verification fails
     */
    @PostMapping("/auth/google")
    public ResponseEntity<AuthResponse> googleLogin(@Valid @RequestBody OAuthLoginRequest request) {
        return ResponseEntity.ok(oauthLogin(AuthProvider.GOOGLE, request));
    }

    /**
     * Sign in with an Apple identity token. Same flow as {@link #googleLogin},
     * with the token verified against Apple's published signing keys.
     *
     * @return 200 with the token and user; 401 "Invalid Apple token" when verification fails
     */
    @PostMapping("/auth/apple")
    public ResponseEntity<AuthResponse> appleLogin(@Valid @RequestBody OAuthLoginRequest request) {
        return ResponseEntity.ok(oauthLogin(AuthProvider.APPLE, request));
    }

    /**
     * @param userId injected by Spring Security from the verified bearer token
     */
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(@AuthenticationPrincipal UserId userId) {
        return ResponseEntity.ok(UserResponse.from(identityResolver.currentUser(userId)));
    }

    private AuthResponse oauthLogin(AuthProvider provider, OAuthLoginRequest request) {
        AuthResult result = identityResolver.oauthLogin(
                provider, request.getToken(), request.getUsername(), request.getAvatar());
        return toResponse(null, result);
    }

    private static AuthResponse toResponse(String message, AuthResult result) {
        return AuthResponse.builder()
                .message(message)
                .token(result.getToken())
                .user(UserResponse.from(result.getUser()))
                .build();
    }
}
