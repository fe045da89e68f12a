package com.agora.forum;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * ForumServiceApplication - Main entry point for the Agora forum service.
 *
 * This service owns the identity and reputation backbone of the forum:
 * - User registration and login with local credentials (BCrypt hashed)
 * - Google and Apple sign-in, including linking to existing accounts
 * - Stateless JWT sessions (72 hours by default)
 * - The per-user, per-target voting ledger behind post and comment scores
 *
 * Everything else (post and comment CRUD, follows, listings) lives outside
 * this service and only shares the relational store.
 *
 * @see com.agora.forum.controller.AuthController for identity endpoints
 * @see com.agora.forum.controller.PostVoteController for post voting
 * @see com.agora.forum.controller.CommentVoteController for comment voting
 */
@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.agora.forum.config")
public class ForumServiceApplication {

    /**
     * Application entry point.
     *
     * @param args Command-line arguments (supports standard Spring Boot args)
     */
    public static void main(String[] args) {
        SpringApplication.run(ForumServiceApplication.class, args);
    }
}
