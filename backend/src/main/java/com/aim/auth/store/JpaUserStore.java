package com.aim.auth.store;

import com.aim.auth.exception.ResourceNotFoundException;
import com.aim.auth.exception.UserConflictException;
import com.aim.auth.model.Role;
import com.aim.auth.model.RevokedToken;
import com.aim.auth.model.UsageRecord;
import com.aim.auth.model.User;
import com.aim.auth.repository.RevokedTokenRepository;
import com.aim.auth.repository.UsageRecordRepository;
import com.aim.auth.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link UserStore} on Spring Data JPA. Uniqueness is held by the unique
 * constraints on {@code users}; the existence checks before insert only
 * pick a precise conflict field for the common, non-racing case.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "aim.store.type", havingValue = "jpa", matchIfMissing = true)
public class JpaUserStore implements UserStore {

    private final UserRepository userRepository;
    private final RevokedTokenRepository revokedTokenRepository;
    private final UsageRecordRepository usageRecordRepository;
    private final StorageAccess storage;

    @Override
    public Optional<User> findByIdentifier(String identifier) {
        String key = UserStore.normalize(identifier);
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        return storage.read("find user by identifier", () -> userRepository.findByUsernameKey(key)
                .or(() -> userRepository.findByEmail(key)));
    }

    @Override
    public Optional<User> findById(String id) {
        return storage.read("find user by id", () -> userRepository.findById(id));
    }

    @Override
    public Optional<User> findByApiKey(String apiKey) {
        return storage.read("find user by api key", () -> userRepository.findByApiKey(apiKey));
    }

    @Override
    public String create(User user) {
        return storage.write("create user", () -> {
            if (userRepository.existsByUsernameKey(user.getUsernameKey())) {
                throw new UserConflictException(UserConflictException.Field.USERNAME);
            }
            if (userRepository.existsByEmail(user.getEmail())) {
                throw new UserConflictException(UserConflictException.Field.EMAIL);
            }
            try {
                return userRepository.saveAndFlush(user).getId();
            } catch (DataIntegrityViolationException e) {
                // lost a race with a concurrent insert
                UserConflictException.Field field = conflictingField(user);
                if (field == null) {
                    throw e;
                }
                log.warn("Unique constraint hit while creating user '{}'", user.getUsername());
                throw new UserConflictException(field, e);
            }
        });
    }

    /** @return the taken field, or null when the violation is not a uniqueness clash */
    private UserConflictException.Field conflictingField(User user) {
        if (userRepository.existsByUsernameKey(user.getUsernameKey())) {
            return UserConflictException.Field.USERNAME;
        }
        if (userRepository.existsByEmail(user.getEmail())) {
            return UserConflictException.Field.EMAIL;
        }
        if (user.getApiKey() != null && userRepository.existsByApiKey(user.getApiKey())) {
            return UserConflictException.Field.API_KEY;
        }
        return null;
    }

    @Override
    public void updateLastLogin(String id, Instant timestamp) {
        requireUpdated(id, storage.write("update last login", () -> userRepository.updateLastLogin(id, timestamp)));
    }

    @Override
    public void updatePassword(String id, String passwordHash, boolean passwordChanged) {
        requireUpdated(id, storage.write("update password",
                () -> userRepository.updatePassword(id, passwordHash, passwordChanged)));
    }

    @Override
    public void updateApiKey(String id, String apiKey) {
        try {
            requireUpdated(id, storage.write("update api key", () -> userRepository.updateApiKey(id, apiKey)));
        } catch (DataIntegrityViolationException e) {
            throw new UserConflictException(UserConflictException.Field.API_KEY, e);
        }
    }

    @Override
    public void setActive(String id, boolean active) {
        requireUpdated(id, storage.write("set active", () -> userRepository.updateActive(id, active)));
    }

    @Override
    public void updateRole(String id, Role role) {
        requireUpdated(id, storage.write("update role", () -> userRepository.updateRole(id, role)));
    }

    @Override
    public long count() {
        return storage.read("count users", userRepository::count);
    }

    @Override
    public long countActive() {
        return storage.read("count active users", userRepository::countByActiveTrue);
    }

    @Override
    public List<User> list() {
        return storage.read("list users", userRepository::findAllByOrderByCreatedAtDesc);
    }

    @Override
    public void saveRevokedToken(RevokedToken revokedToken) {
        storage.write("revoke token", () -> revokedTokenRepository.save(revokedToken));
    }

    @Override
    public boolean isTokenRevoked(String tokenId) {
        return storage.read("check revocation", () -> revokedTokenRepository.existsByTokenId(tokenId));
    }

    @Override
    public int deleteRevokedTokensExpiredBefore(Instant cutoff) {
        return storage.write("purge revocations", () -> revokedTokenRepository.deleteExpiredBefore(cutoff));
    }

    @Override
    public void appendUsage(UsageRecord record) {
        storage.write("append usage", () -> usageRecordRepository.save(record));
    }

    @Override
    public List<UsageRecord> findUsageSince(Instant since) {
        return storage.read("find usage", () -> usageRecordRepository.findByTimestampGreaterThanEqual(since));
    }

    @Override
    public long countUsageSince(String userId, Instant since) {
        return storage.read("count usage",
                () -> usageRecordRepository.countByUserIdAndTimestampGreaterThanEqual(userId, since));
    }

    private static void requireUpdated(String id, int rows) {
        if (rows == 0) {
            throw new ResourceNotFoundException("User", id);
        }
    }
}
