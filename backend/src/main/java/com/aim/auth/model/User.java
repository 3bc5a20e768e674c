package com.aim.auth.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Platform account.
 *
 * Username and email are unique ignoring case: the lower-cased copies in
 * {@code usernameKey} / {@code email} carry the unique constraints, so
 * concurrent registrations are decided by the database, not by a
 * read-then-write in the service layer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "users", indexes = {
        @Index(name = "idx_users_created_at", columnList = "createdAt")
})
public class User {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    /** Display form, as entered at registration. */
    @Column(nullable = false, length = 50)
    private String username;

    /** Lower-cased username, unique. */
    @Column(nullable = false, unique = true, length = 50)
    private String usernameKey;

    /** Stored lower-cased, unique. */
    @Column(nullable = false, unique = true, length = 100)
    private String email;

    @ToString.Exclude
    @Column(nullable = false)
    private String passwordHash;      // BCrypt

    @Column(length = 100)
    private String fullName;

    @Column(length = 100)
    private String company;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private Role role = Role.USER;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    /** False while the account still uses a password handed out by an admin. */
    @Column(nullable = false)
    @Builder.Default
    private boolean passwordChanged = true;

    /** SHA-256 digest of the live API key; null when none was issued. */
    @ToString.Exclude
    @Column(unique = true, length = 64)
    private String apiKey;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column
    private Instant lastLogin;
}
