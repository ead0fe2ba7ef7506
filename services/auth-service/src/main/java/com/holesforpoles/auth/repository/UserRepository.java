package com.holesforpoles.auth.repository;

import com.holesforpoles.auth.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * UserRepository - Data Access Layer for User entities.
 *
 * Spring Data JPA derives the queries from the method names:
 * - findByUsername -> SELECT * FROM users WHERE username = ?
 * - findByEmail    -> SELECT * FROM users WHERE email = ?
 * - existsBy...    -> SELECT COUNT(*) > 0 ...
 *
 * Lookups are exact and case-sensitive, matching the unique constraints.
 * Callers lower-case the email domain before storing or looking one up.
 *
 * @see User for the table definition
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Primary login lookup. The login form sends one identifier which is
     * tried as a username first.
     */
    Optional<User> findByUsername(String username);

    /**
     * Fallback login lookup when no username matched.
     */
    Optional<User> findByEmail(String email);

    /**
     * Registration pre-check for the email constraint.
     *
     * @param email normalized email address
     * @return true if an account already uses it
     */
    boolean existsByEmail(String email);

    /**
     * Registration pre-check for the username constraint.
     *
     * @param username trimmed username
     * @return true if an account already uses it
     */
    boolean existsByUsername(String username);
}
