package com.agora.forum.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AuthResponse - returned by register, login and both OAuth logins.
 *
 * <pre>
 * {
 *   "message": "Login successful",
 *   "token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "user": { "id": 1, "username": "alice", ... }
 * }
 * </pre>
 *
 * The client sends the token back as {@code Authorization: Bearer <token>}
 * until it expires (72 hours) and drops it to log out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {

    private String message;
    private String token;
    private UserResponse user;
}
