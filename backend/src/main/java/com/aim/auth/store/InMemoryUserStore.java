package com.aim.auth.store;

import com.aim.auth.exception.ResourceNotFoundException;
import com.aim.auth.exception.UserConflictException;
import com.aim.auth.model.Role;
import com.aim.auth.model.RevokedToken;
import com.aim.auth.model.UsageRecord;
import com.aim.auth.model.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-memory {@link UserStore} using thread-safe maps.
 *
 * Lookups are lock-free. Every mutation that touches a unique index
 * (create, api key change) runs under one monitor so check-and-insert is
 * atomic. Returned users are copies; callers cannot mutate stored state.
 *
 * NOTE: Data is lost on restart. Select with {@code aim.store.type=memory}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "aim.store.type", havingValue = "memory")
public class InMemoryUserStore implements UserStore {

    // id → User
    private final Map<String, User> users = new ConcurrentHashMap<>();
    // unique indexes → id
    private final Map<String, String> byUsernameKey = new ConcurrentHashMap<>();
    private final Map<String, String> byEmail = new ConcurrentHashMap<>();
    private final Map<String, String> byApiKey = new ConcurrentHashMap<>();

    private final Map<String, RevokedToken> revokedTokens = new ConcurrentHashMap<>();
    private final Queue<UsageRecord> usage = new ConcurrentLinkedQueue<>();

    private final Object indexLock = new Object();

    @Override
    public Optional<User> findByIdentifier(String identifier) {
        String key = UserStore.normalize(identifier);
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        String id = byUsernameKey.get(key);
        if (id == null) {
            id = byEmail.get(key);
        }
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public Optional<User> findById(String id) {
        return Optional.ofNullable(users.get(id)).map(InMemoryUserStore::copy);
    }

    @Override
    public Optional<User> findByApiKey(String apiKey) {
        if (apiKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byApiKey.get(apiKey)).flatMap(this::findById);
    }

    @Override
    public String create(User user) {
        synchronized (indexLock) {
            if (byUsernameKey.containsKey(user.getUsernameKey())) {
                throw new UserConflictException(UserConflictException.Field.USERNAME);
            }
            if (byEmail.containsKey(user.getEmail())) {
                throw new UserConflictException(UserConflictException.Field.EMAIL);
            }
            if (user.getApiKey() != null && byApiKey.containsKey(user.getApiKey())) {
                throw new UserConflictException(UserConflictException.Field.API_KEY);
            }
            User stored = copy(user);
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            users.put(stored.getId(), stored);
            byUsernameKey.put(stored.getUsernameKey(), stored.getId());
            byEmail.put(stored.getEmail(), stored.getId());
            if (stored.getApiKey() != null) {
                byApiKey.put(stored.getApiKey(), stored.getId());
            }
            log.info("User saved: {}", stored.getUsername());
            return stored.getId();
        }
    }

    @Override
    public void updateLastLogin(String id, Instant timestamp) {
        mutate(id, user -> user.setLastLogin(timestamp));
    }

    @Override
    public void updatePassword(String id, String passwordHash, boolean passwordChanged) {
        mutate(id, user -> {
            user.setPasswordHash(passwordHash);
            user.setPasswordChanged(passwordChanged);
        });
    }

    @Override
    public void updateApiKey(String id, String apiKey) {
        synchronized (indexLock) {
            User user = users.get(id);
            if (user == null) {
                throw new ResourceNotFoundException("User", id);
            }
            String owner = apiKey == null ? null : byApiKey.get(apiKey);
            if (owner != null && !owner.equals(id)) {
                throw new UserConflictException(UserConflictException.Field.API_KEY);
            }
            if (user.getApiKey() != null) {
                byApiKey.remove(user.getApiKey());
            }
            if (apiKey != null) {
                byApiKey.put(apiKey, id);
            }
            mutate(id, u -> u.setApiKey(apiKey));
        }
    }

    @Override
    public void setActive(String id, boolean active) {
        mutate(id, user -> user.setActive(active));
    }

    @Override
    public void updateRole(String id, Role role) {
        mutate(id, user -> user.setRole(role));
    }

    @Override
    public long count() {
        return users.size();
    }

    @Override
    public long countActive() {
        return users.values().stream().filter(User::isActive).count();
    }

    @Override
    public List<User> list() {
        return users.values().stream()
                .sorted(Comparator.comparing(User::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .reversed())
                .map(InMemoryUserStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public void saveRevokedToken(RevokedToken revokedToken) {
        revokedTokens.put(revokedToken.getTokenId(), revokedToken);
    }

    @Override
    public boolean isTokenRevoked(String tokenId) {
        return tokenId != null && revokedTokens.containsKey(tokenId);
    }

    @Override
    public int deleteRevokedTokensExpiredBefore(Instant cutoff) {
        int removed = 0;
        for (RevokedToken entry : revokedTokens.values()) {
            if (entry.getExpiresAt().isBefore(cutoff) && revokedTokens.remove(entry.getTokenId(), entry)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void appendUsage(UsageRecord record) {
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        usage.add(record);
    }

    @Override
    public List<UsageRecord> findUsageSince(Instant since) {
        return usage.stream()
                .filter(r -> !r.getTimestamp().isBefore(since))
                .collect(Collectors.toList());
    }

    @Override
    public long countUsageSince(String userId, Instant since) {
        return usage.stream()
                .filter(r -> r.getUserId().equals(userId) && !r.getTimestamp().isBefore(since))
                .count();
    }

    private void mutate(String id, Consumer<User> change) {
        User updated = users.computeIfPresent(id, (key, current) -> {
            User next = copy(current);
            change.accept(next);
            return next;
        });
        if (updated == null) {
            throw new ResourceNotFoundException("User", id);
        }
    }

    private static User copy(User user) {
        return user.toBuilder().build();
    }
}
