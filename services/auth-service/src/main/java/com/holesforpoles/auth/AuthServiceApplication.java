package com.holesforpoles.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

/**
 * AuthServiceApplication - Entry point for the authentication service.
 *
 * Responsibilities:
 * - Account registration with unique username and email
 * - Username/email + password login issuing stateless HS256 tokens
 * - Bearer-token protected profile and refresh endpoints
 *
 * Architecture Context:
 * - Runs on port 8000 (application.yml)
 * - Persists users through JPA (H2 locally, PostgreSQL via DATABASE_URL)
 * - No server-side session state; tokens carry everything needed to verify them
 *
 * The default in-memory user store is excluded: accounts live in the users table.
 *
 * @see com.holesforpoles.auth.controller.AuthController for endpoints
 * @see com.holesforpoles.auth.service.AuthService for business logic
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class AuthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
