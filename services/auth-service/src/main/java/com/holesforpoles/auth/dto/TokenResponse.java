package com.holesforpoles.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TokenResponse - Returned by login and refresh.
 *
 * <pre>
 * {
 *   "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "token_type": "bearer"
 * }
 * </pre>
 *
 * The client sends the token back as {@code Authorization: Bearer <token>}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

    public static final String BEARER = "bearer";

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("token_type")
    private String tokenType;

    /**
     * @param accessToken compact signed token
     * @return response with token type "bearer"
     */
    public static TokenResponse bearer(String accessToken) {
        return new TokenResponse(accessToken, BEARER);
    }
}
