package com.aim.auth.admin;

import com.aim.auth.auth.AuthService;
import com.aim.auth.auth.RegistrationResult;
import com.aim.auth.auth.UserProfile;
import com.aim.auth.exception.ResourceNotFoundException;
import com.aim.auth.model.Role;
import com.aim.auth.model.User;
import com.aim.auth.security.AccessControl;
import com.aim.auth.security.CredentialHasher;
import com.aim.auth.security.TemporaryPasswordGenerator;
import com.aim.auth.security.UserPrincipal;
import com.aim.auth.store.UserStore;
import com.aim.auth.usage.UsageStats;
import com.aim.auth.usage.UsageStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Administrative operations. Every method first requires {@link Role#ADMIN}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    static final int MAX_STATS_DAYS = 365;

    private final UserStore userStore;
    private final AccessControl accessControl;
    private final UsageStatsService usageStatsService;
    private final AuthService authService;
    private final CredentialHasher credentialHasher;
    private final TemporaryPasswordGenerator passwordGenerator;

    public List<UserSummary> listUsers(UserPrincipal admin) {
        accessControl.requireRole(admin, Role.ADMIN);
        return userStore.list().stream()
                .map(UserSummary::from)
                .collect(Collectors.toList());
    }

    /**
     * Creates an account with a generated temporary password that must be
     * changed after the first login.
     *
     * @throws com.aim.auth.exception.RegistrationException as for self-registration
     */
    public ProvisionedUser createUser(UserPrincipal admin, String username, String email,
                                      UserProfile profile, Role role) {
        accessControl.requireRole(admin, Role.ADMIN);
        String temporaryPassword = passwordGenerator.generate();
        RegistrationResult result = authService.createUser(username, email, temporaryPassword, profile,
                role == null ? Role.USER : role, false);

        log.info("Admin '{}' created user '{}' (id={})", admin.getUsername(), username, result.getUserId());
        return ProvisionedUser.builder()
                .userId(result.getUserId())
                .username(username.trim())
                .temporaryPassword(temporaryPassword)
                .apiKey(result.getApiKey())
                .build();
    }

    /**
     * Replaces the user's password with a generated temporary one. Also the
     * way back in for accounts whose stored hash can no longer be verified.
     */
    public ProvisionedUser resetPassword(UserPrincipal admin, String userId) {
        accessControl.requireRole(admin, Role.ADMIN);
        User user = userStore.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));

        String temporaryPassword = passwordGenerator.generate();
        userStore.updatePassword(userId, credentialHasher.hash(temporaryPassword), false);
        log.info("Admin '{}' reset the password of user '{}'", admin.getUsername(), user.getUsername());
        return ProvisionedUser.builder()
                .userId(userId)
                .username(user.getUsername())
                .temporaryPassword(temporaryPassword)
                .build();
    }

    /**
     * Flips the account's active flag.
     *
     * @return the new state
     */
    public boolean toggleActive(UserPrincipal admin, String userId) {
        accessControl.requireRole(admin, Role.ADMIN);
        if (admin.getUserId().equals(userId)) {
            throw new IllegalArgumentException("Administrators cannot deactivate their own account.");
        }
        User user = userStore.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));

        boolean active = !user.isActive();
        userStore.setActive(userId, active);
        log.info("Admin '{}' {} user '{}'", admin.getUsername(), active ? "activated" : "deactivated",
                user.getUsername());
        return active;
    }

    /**
     * Changes a user's role. Takes effect on their next token refresh.
     */
    public UserSummary changeRole(UserPrincipal admin, String userId, Role role) {
        accessControl.requireRole(admin, Role.ADMIN);
        userStore.updateRole(userId, role);
        log.info("Admin '{}' set role of user id={} to {}", admin.getUsername(), userId, role.getValue());
        return userStore.findById(userId)
                .map(UserSummary::from)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    public UsageStats usageStats(UserPrincipal admin, int sinceDays) {
        accessControl.requireRole(admin, Role.ADMIN);
        int days = Math.max(1, Math.min(sinceDays, MAX_STATS_DAYS));
        return usageStatsService.usageStats(days);
    }
}
