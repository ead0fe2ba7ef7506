package com.holesforpoles.auth.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * User - JPA Entity representing one registered account.
 *
 * Maps to the 'users' table. The table is the only persistent state of the
 * service; tokens are never stored.
 *
 * Table Schema:
 * - id: Numeric primary key, assigned by the database on insert
 * - username: Unique login name, 3-50 characters
 * - email: Unique email address, also accepted as login identifier
 * - hashed_password: BCrypt hash, never the plaintext
 * - full_name: Optional display name
 * - is_active: Inactive accounts cannot log in and their tokens are refused
 * - is_superuser: Grants ROLE_SUPERUSER to the authenticated principal
 * - created_at / updated_at: Maintained by Hibernate
 *
 * The unique constraints on username and email are what actually serialize
 * concurrent registrations; the service-level pre-check only produces the
 * friendlier error in the common case.
 *
 * @see com.holesforpoles.auth.repository.UserRepository for lookups
 * @see com.holesforpoles.auth.service.AuthService for creation
 */
@Entity
@Table(name = "users",
        uniqueConstraints = {
                @UniqueConstraint(name = User.UK_USERNAME, columnNames = "username"),
                @UniqueConstraint(name = User.UK_EMAIL, columnNames = "email")
        })
@Getter
@Setter
@ToString(exclude = "hashedPassword")
@NoArgsConstructor  // required by JPA
@AllArgsConstructor
@Builder
public class User {

    public static final String UK_USERNAME = "uk_users_username";
    public static final String UK_EMAIL = "uk_users_email";

    /**
     * Identity of the account, also used as the token subject.
     * Never changes once assigned.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false)
    private Long id;

    @Column(name = "username", nullable = false, length = 50)
    private String username;

    @Column(name = "email", nullable = false)
    private String email;

    /** BCrypt hash produced by CredentialHasher. */
    @Column(name = "hashed_password", nullable = false)
    private String hashedPassword;

    @Column(name = "full_name")
    private String fullName;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Builder.Default
    @Column(name = "is_superuser", nullable = false)
    private boolean superuser = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
