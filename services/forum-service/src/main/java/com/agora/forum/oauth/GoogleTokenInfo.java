package com.agora.forum.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Response body of Google's tokeninfo endpoint.
 *
 * Google sends {@code email_verified} as the string "true" on this endpoint
 * and as a boolean elsewhere; Jackson reads either into the String field.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoogleTokenInfo {

    @JsonProperty("sub")
    private String sub;

    @JsonProperty("aud")
    private String aud;

    @JsonProperty("email")
    private String email;

    @JsonProperty("email_verified")
    private String emailVerified;

    @JsonProperty("picture")
    private String picture;

    @JsonProperty("name")
    private String name;
}
