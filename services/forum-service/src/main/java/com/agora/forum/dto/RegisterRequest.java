package com.agora.forum.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RegisterRequest - payload for creating a local (email/password) account.
 *
 * <pre>
 * POST /api/register
 * {
 *   "username": "alice",
 *   "email": "alice@example.com",
 *   "password": "secret1",
 *   "avatar": "3"
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @NotBlank
    @Size(max = 50)
    private String username;

    @NotBlank
    @Email
    private String email;

    @NotBlank
    @Size(min = 6, max = 72)
    private String password;

    /** Preset number "1".."6" or an image URL. Optional. */
    @Size(max = 1024)
    private String avatar;
}
