package com.aim.auth;

import com.aim.auth.admin.AdminService;
import com.aim.auth.auth.AuthService;
import com.aim.auth.model.Role;
import com.aim.auth.model.User;
import com.aim.auth.security.AccessControl;
import com.aim.auth.security.ApiKeyService;
import com.aim.auth.security.CredentialHasher;
import com.aim.auth.security.PasswordPolicy;
import com.aim.auth.security.TemporaryPasswordGenerator;
import com.aim.auth.security.TokenService;
import com.aim.auth.store.InMemoryUserStore;
import com.aim.auth.store.UserStore;
import com.aim.auth.usage.UsageStatsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Instant;
import java.util.UUID;

/**
 * Wires the auth core by hand on top of {@link InMemoryUserStore} so unit
 * tests run without a Spring context.
 */
public class AuthTestFixture {

    public static final String SECRET = "ZGV2LW9ubHktdGVzdC1zZWNyZXQta2V5LWZvci1haW0tYXV0aC0xMjM0NTY3OA==";
    public static final long ACCESS_TTL_MS = 86_400_000L;
    public static final long REFRESH_TTL_MS = 2_592_000_000L;
    public static final Instant START = Instant.parse("2026-03-02T10:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final InMemoryUserStore store = new InMemoryUserStore();
    public final PasswordPolicy passwordPolicy = new PasswordPolicy();
    public final CredentialHasher hasher = new CredentialHasher(new BCryptPasswordEncoder(4));
    public final TokenService tokenService =
            new TokenService(SECRET, ACCESS_TTL_MS, REFRESH_TTL_MS, store, clock);
    public final ApiKeyService apiKeyService = new ApiKeyService(store);
    public final AccessControl accessControl = new AccessControl(tokenService, apiKeyService, store);
    public final UsageStatsService usageStatsService = new UsageStatsService(store, clock);
    public final AuthService authService = new AuthService(store, passwordPolicy, hasher, tokenService,
            apiKeyService, accessControl, usageStatsService, clock);
    public final TemporaryPasswordGenerator passwordGenerator = new TemporaryPasswordGenerator();
    public final AdminService adminService = new AdminService(store, accessControl, usageStatsService,
            authService, hasher, passwordGenerator);

    /** Inserts a user directly into the store with password "Abcd123!". */
    public User createUser(String username, Role role) {
        User user = User.builder()
                .id(UUID.randomUUID().toString())
                .username(username)
                .usernameKey(UserStore.normalize(username))
                .email(UserStore.normalize(username + "@example.com"))
                .passwordHash(hasher.hash("Abcd123!"))
                .role(role)
                .active(true)
                .createdAt(clock.instant())
                .build();
        store.create(user);
        return user;
    }
}
