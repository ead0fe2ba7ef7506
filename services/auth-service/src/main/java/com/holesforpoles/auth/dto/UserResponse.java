package com.holesforpoles.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.holesforpoles.auth.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * UserResponse - Public view of an account, returned by register and /auth/me.
 *
 * Deliberately has no password field of any kind.
 *
 * <pre>
 * {
 *   "id": 1,
 *   "email": "alice@example.com",
 *   "username": "alice",
 *   "full_name": "Alice Example",
 *   "is_active": true,
 *   "created_at": "2025-01-15T10:30:00",
 *   "updated_at": "2025-01-15T10:30:00"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private Long id;

    private String email;

    private String username;

    @JsonProperty("full_name")
    private String fullName;

    @JsonProperty("is_active")
    private boolean active;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .username(user.getUsername())
                .fullName(user.getFullName())
                .active(user.isActive())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
