package com.agora.forum.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * LoginRequest - payload for email/password login.
 *
 * Only non-blank checks happen here. The email format is not validated so a
 * malformed address fails with the same "Invalid credentials" as a wrong
 * password.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank
    private String email;

    @NotBlank
    private String password;
}
