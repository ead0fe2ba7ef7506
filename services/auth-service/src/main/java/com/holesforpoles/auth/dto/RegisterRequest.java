package com.holesforpoles.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * RegisterRequest - Payload for creating a new account.
 *
 * <pre>
 * POST /auth/register
 * Content-Type: application/json
 *
 * {
 *   "email": "alice@example.com",
 *   "username": "alice",
 *   "full_name": "Alice Example",
 *   "password": "Secret123"
 * }
 * </pre>
 *
 * No annotation-driven validation here: RegistrationValidator checks the
 * fields explicitly before the service touches the store.
 *
 * Never log the password field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    private String email;

    private String username;

    @JsonProperty("full_name")
    private String fullName;

    @ToString.Exclude
    private String password;
}
