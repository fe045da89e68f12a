package com.agora.forum.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * OAuthLoginRequest - payload for Google and Apple sign-in.
 *
 * username and avatar are only used when the sign-in creates a new account
 * (avatar may also fill an empty avatar on an existing one).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OAuthLoginRequest {

    /** ID token obtained by the client from the provider. */
    @NotBlank
    private String token;

    @Size(max = 50)
    private String username;

    @Size(max = 1024)
    private String avatar;
}
