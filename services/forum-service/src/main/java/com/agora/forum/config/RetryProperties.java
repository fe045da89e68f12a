package com.agora.forum.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry caps for writes that can lose a race on a unique constraint.
 */
@Data
@ConfigurationProperties(prefix = "forum.retry")
public class RetryProperties {

    /** Attempts for a single vote cast before giving up with a 503. */
    private int voteMaxAttempts = 5;

    /** Attempts for resolving a federated login before giving up with a 503. */
    private int identityMaxAttempts = 5;
}
