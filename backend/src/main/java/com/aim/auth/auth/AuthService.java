package com.aim.auth.auth;

import com.aim.auth.exception.AuthErrorKind;
import com.aim.auth.exception.AuthException;
import com.aim.auth.exception.PolicyViolationException;
import com.aim.auth.exception.RegistrationErrorKind;
import com.aim.auth.exception.RegistrationException;
import com.aim.auth.exception.UserConflictException;
import com.aim.auth.model.Role;
import com.aim.auth.model.User;
import com.aim.auth.security.AccessControl;
import com.aim.auth.security.ApiKeyService;
import com.aim.auth.security.CredentialHasher;
import com.aim.auth.security.PasswordPolicy;
import com.aim.auth.security.RequestCredentials;
import com.aim.auth.security.TokenService;
import com.aim.auth.security.UserPrincipal;
import com.aim.auth.store.UserStore;
import com.aim.auth.usage.UsageStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * AuthService is the entry point for account operations:
 * registration, login, token refresh, logout, password change and API key
 * regeneration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    // no '@': usernames and emails share the login identifier namespace
    private static final Pattern USERNAME_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{3,50}$");
    private static final int MAX_EMAIL_LENGTH = 100;
    private static final int MAX_PROFILE_FIELD_LENGTH = 100;

    private final UserStore         userStore;
    private final PasswordPolicy    passwordPolicy;
    private final CredentialHasher  credentialHasher;
    private final TokenService      tokenService;
    private final ApiKeyService     apiKeyService;
    private final AccessControl     accessControl;
    private final UsageStatsService usageStatsService;
    private final Clock             clock;

    // ── Registration ──────────────────────────────────────────────────────

    /**
     * Registers a regular user and issues their first API key.
     *
     * @throws RegistrationException INVALID_USERNAME, INVALID_EMAIL, WEAK_PASSWORD, USERNAME_TAKEN or EMAIL_TAKEN
     */
    public RegistrationResult register(String username, String email, String rawPassword, UserProfile profile) {
        return createUser(username, email, rawPassword, profile, Role.USER, true);
    }

    /**
     * Creates an account with the given role. Used by registration, by the
     * admin bootstrap and by admin provisioning, which passes
     * {@code passwordChanged=false} for a generated temporary password.
     */
    public RegistrationResult createUser(String username, String email, String rawPassword,
                                         UserProfile profile, Role role, boolean passwordChanged) {
        String trimmedUsername = username == null ? null : username.trim();
        if (trimmedUsername == null || !USERNAME_PATTERN.matcher(trimmedUsername).matches()) {
            throw new RegistrationException(RegistrationErrorKind.INVALID_USERNAME,
                    "Username must be 3 to 50 characters: letters, digits, '.', '_' or '-'.");
        }
        String normalizedEmail = UserStore.normalize(email);
        if (normalizedEmail == null || normalizedEmail.length() > MAX_EMAIL_LENGTH
                || !EMAIL_PATTERN.matcher(normalizedEmail).matches()) {
            throw new RegistrationException(RegistrationErrorKind.INVALID_EMAIL, "Invalid email format.");
        }
        try {
            passwordPolicy.validate(rawPassword);
        } catch (PolicyViolationException e) {
            throw new RegistrationException(RegistrationErrorKind.WEAK_PASSWORD, e.getMessage(), e);
        }

        UserProfile details = profile == null ? UserProfile.EMPTY : profile;
        requireMaxLength("Full name", details.getFullName());
        requireMaxLength("Company", details.getCompany());

        String apiKey = apiKeyService.generateKey();
        User user = User.builder()
                .id(UUID.randomUUID().toString())
                .username(trimmedUsername)
                .usernameKey(UserStore.normalize(trimmedUsername))
                .email(normalizedEmail)
                .passwordHash(credentialHasher.hash(rawPassword))
                .fullName(details.getFullName())
                .company(details.getCompany())
                .role(role)
                .active(true)
                .passwordChanged(passwordChanged)
                .apiKey(apiKeyService.digest(apiKey))
                .createdAt(clock.instant())
                .build();

        String userId;
        try {
            userId = userStore.create(user);
        } catch (UserConflictException e) {
            switch (e.getField()) {
                case USERNAME:
                    throw new RegistrationException(RegistrationErrorKind.USERNAME_TAKEN,
                            "This username is already taken.", e);
                case EMAIL:
                    throw new RegistrationException(RegistrationErrorKind.EMAIL_TAKEN,
                            "This email is already registered.", e);
                default:
                    throw new IllegalStateException("Generated API key collided with an existing key", e);
            }
        }

        log.info("Registered user '{}' (id={}, role={})", user.getUsername(), userId, role.getValue());
        return RegistrationResult.builder()
                .userId(userId)
                .apiKey(apiKey)
                .build();
    }

    // ── Login / tokens ────────────────────────────────────────────────────

    /**
     * The password is checked before the active flag, so only a caller who
     * knows the password learns that the account is deactivated.
     *
     * @throws AuthException INVALID_CREDENTIALS or ACCOUNT_INACTIVE
     */
    public AuthResponse login(String identifier, String rawPassword) {
        User user = userStore.findByIdentifier(identifier).orElse(null);

        if (user == null || !credentialHasher.verify(rawPassword, user.getPasswordHash())) {
            log.warn("Login failed for '{}': bad credentials", identifier);
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS, "Invalid username or password.");
        }
        if (!user.isActive()) {
            log.warn("Login refused for '{}': account inactive", user.getUsername());
            throw new AuthException(AuthErrorKind.ACCOUNT_INACTIVE, "This account is deactivated.");
        }

        userStore.updateLastLogin(user.getId(), clock.instant());

        UserPrincipal principal = UserPrincipal.of(user);
        log.info("Login successful for '{}'", user.getUsername());
        return AuthResponse.builder()
                .accessToken(tokenService.issueAccessToken(principal))
                .refreshToken(tokenService.issueRefreshToken(principal))
                .expiresInSeconds(accessTtlSeconds())
                .passwordChangeRequired(!user.isPasswordChanged())
                .build();
    }

    public UserPrincipal authenticateRequest(RequestCredentials credentials) {
        return accessControl.authenticate(credentials);
    }

    /**
     * Exchanges a refresh token for a new access token. The refresh token is
     * returned unchanged.
     */
    public AuthResponse refreshAccess(String refreshToken) {
        String accessToken = tokenService.refresh(refreshToken);
        return AuthResponse.builder()
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .expiresInSeconds(accessTtlSeconds())
                .build();
    }

    /**
     * Revokes the presented access token and, when given, the refresh token.
     * A refresh token issued to someone else is ignored.
     */
    public void logout(UserPrincipal principal, String accessToken, String refreshToken) {
        if (accessToken != null) {
            tokenService.revoke(accessToken, principal.getUserId());
        }
        if (refreshToken != null && !refreshToken.isBlank()) {
            tokenService.revoke(refreshToken, principal.getUserId());
        }
        log.info("Logout for '{}'", principal.getUsername());
    }

    // ── Account maintenance ───────────────────────────────────────────────

    /**
     * @throws AuthException INVALID_CREDENTIALS when the current password is wrong
     * @throws PolicyViolationException when the new password is too weak
     * @throws IllegalArgumentException when the new password equals the current one
     */
    public void changePassword(String userId, String currentPassword, String newPassword) {
        User user = requireUser(userId);

        if (!credentialHasher.verify(currentPassword, user.getPasswordHash())) {
            log.warn("Password change refused for '{}': current password incorrect", user.getUsername());
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS, "Current password is incorrect.");
        }
        passwordPolicy.validate(newPassword);
        if (newPassword.equals(currentPassword)) {
            throw new IllegalArgumentException("New password must differ from the current password.");
        }

        userStore.updatePassword(userId, credentialHasher.hash(newPassword), true);
        log.info("Password changed for '{}'", user.getUsername());
    }

    public String regenerateApiKey(String userId) {
        return apiKeyService.issue(userId);
    }

    public ProfileResponse profile(UserPrincipal principal) {
        User user = requireUser(principal.getUserId());
        return ProfileResponse.builder()
                .userId(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .company(user.getCompany())
                .role(user.getRole())
                .createdAt(user.getCreatedAt())
                .lastLogin(user.getLastLogin())
                .passwordChanged(user.isPasswordChanged())
                .apiCallsToday(usageStatsService.callsToday(user.getId()))
                .build();
    }

    public long accessTtlSeconds() {
        return tokenService.getAccessTokenExpiration() / 1000;
    }

    private static void requireMaxLength(String field, String value) {
        if (value != null && value.length() > MAX_PROFILE_FIELD_LENGTH) {
            throw new IllegalArgumentException(field + " must be at most " + MAX_PROFILE_FIELD_LENGTH + " characters.");
        }
    }

    private User requireUser(String userId) {
        return userStore.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorKind.USER_NOT_FOUND, "User not found: " + userId));
    }
}
