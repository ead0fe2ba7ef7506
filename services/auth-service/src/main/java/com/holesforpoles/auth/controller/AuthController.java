package com.holesforpoles.auth.controller;

import com.holesforpoles.auth.dto.RegisterRequest;
import com.holesforpoles.auth.dto.TokenResponse;
import com.holesforpoles.auth.dto.UserResponse;
import com.holesforpoles.auth.entity.User;
import com.holesforpoles.auth.service.AuthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * AuthController - REST API endpoints for account authentication.
 *
 * Endpoints:
 * - POST /auth/register - Create an account (public)
 * - POST /auth/login    - Exchange username/email and password for a token (public)
 * - GET  /auth/me       - Current account (bearer token)
 * - POST /auth/refresh  - New token for the current account (bearer token)
 *
 * Error Handling (see GlobalExceptionHandler):
 * - 400 Bad Request: duplicate email/username, weak password, invalid fields
 * - 401 Unauthorized: bad credentials, inactive account, invalid token
 * - 500 Internal Server Error: anything unexpected, without detail
 *
 * @see AuthService for business logic
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    /**
     * Register a new account.
     *
     * @param request email, username, optional full_name, password
     * @return 201 with the created account (no password hash)
     */
    @PostMapping(value = "/register", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UserResponse> register(@RequestBody RegisterRequest request) {
        User user = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    /**
     * Log in with a form-encoded username (or email) and password.
     *
     * <pre>
     * POST /auth/login
     * Content-Type: application/x-www-form-urlencoded
     *
     * username=alice&amp;password=Secret123
     * </pre>
     *
     * @return 200 with access_token and token_type "bearer"
     */
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<TokenResponse> login(@RequestParam String username,
                                               @RequestParam String password) {
        return ResponseEntity.ok(authService.login(username, password));
    }

    /**
     * The account the bearer token belongs to.
     *
     * @param currentUser resolved by JwtAuthenticationFilter from the Authorization header
     */
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(@AuthenticationPrincipal User currentUser) {
        return ResponseEntity.ok(UserResponse.from(currentUser));
    }

    /**
     * Issue a new token with a full lifetime for the current account.
     */
    @PostMapping("/refresh")
    public ResponseEntity<TokenResponse> refresh(@AuthenticationPrincipal User currentUser) {
        return ResponseEntity.ok(authService.refresh(currentUser));
    }
}
