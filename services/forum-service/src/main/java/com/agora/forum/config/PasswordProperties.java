package com.agora.forum.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Local password hashing settings, bound from {@code security.password.*}.
 */
@Data
@ConfigurationProperties(prefix = "security.password")
public class PasswordProperties {

    /** BCrypt log rounds. 10 keeps a verify in the tens of milliseconds. */
    private int bcryptStrength = 10;
}
