package com.aim.auth.store;

import com.aim.auth.exception.ResourceNotFoundException;
import com.aim.auth.exception.UserConflictException;
import com.aim.auth.model.Role;
import com.aim.auth.model.RevokedToken;
import com.aim.auth.model.UsageRecord;
import com.aim.auth.model.User;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Persistence contract required by the auth core: users, revoked tokens and
 * usage records. Implementations enforce username / email / API-key
 * uniqueness atomically, so two concurrent {@link #create} calls with the
 * same username never both succeed.
 *
 * <p>Update methods throw {@link ResourceNotFoundException} for an unknown id.
 * Backends that talk to a remote engine surface timeouts and connection loss
 * as {@link com.aim.auth.exception.StorageUnavailableException}.</p>
 */
public interface UserStore {

    // ── Users ─────────────────────────────────────────────────────────────

    /** Matches username OR email, ignoring case. */
    Optional<User> findByIdentifier(String identifier);

    Optional<User> findById(String id);

    /** Looks up by the stored API key value (the digest, see ApiKeyService). */
    Optional<User> findByApiKey(String apiKey);

    /**
     * Inserts a new user. {@code usernameKey} and {@code email} must already be
     * normalized with {@link #normalize(String)}.
     *
     * @return the new user's id
     * @throws UserConflictException if username, email or API key is taken
     */
    String create(User user);

    void updateLastLogin(String id, Instant timestamp);

    /**
     * Replaces the password hash. {@code passwordChanged} is false when the
     * new password was generated by an admin and must be changed on first use.
     */
    void updatePassword(String id, String passwordHash, boolean passwordChanged);

    void updateApiKey(String id, String apiKey);

    void setActive(String id, boolean active);

    void updateRole(String id, Role role);

    long count();

    long countActive();

    /** All users, newest first. */
    List<User> list();

    // ── Revoked tokens ────────────────────────────────────────────────────

    void saveRevokedToken(RevokedToken revokedToken);

    boolean isTokenRevoked(String tokenId);

    /** @return number of entries removed */
    int deleteRevokedTokensExpiredBefore(Instant cutoff);

    // ── Usage ─────────────────────────────────────────────────────────────

    void appendUsage(UsageRecord record);

    List<UsageRecord> findUsageSince(Instant since);

    long countUsageSince(String userId, Instant since);

    /** Case-folding used for the unique username and email keys. */
    static String normalize(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }
}
