package com.aim.auth.auth;

import com.aim.auth.AuthTestFixture;
import com.aim.auth.exception.AuthErrorKind;
import com.aim.auth.exception.AuthException;
import com.aim.auth.exception.PolicyViolationException;
import com.aim.auth.exception.RegistrationErrorKind;
import com.aim.auth.exception.RegistrationException;
import com.aim.auth.model.Role;
import com.aim.auth.model.UsageRecord;
import com.aim.auth.model.User;
import com.aim.auth.security.PasswordRule;
import com.aim.auth.security.RequestCredentials;
import com.aim.auth.security.TokenType;
import com.aim.auth.security.UserPrincipal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Account flows end to end on the in-memory store.
 */
class AuthServiceTest {

    private AuthTestFixture fixture;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        fixture = new AuthTestFixture();
        authService = fixture.authService;
    }

    @Test
    void registerLoginAuthenticate_ThenDeactivation_CutsOffAccess() {
        RegistrationResult registration = authService.register("alice", "alice@x.com", "Abcd123!", null);
        assertThat(registration.getUserId()).isNotBlank();
        assertThat(registration.getApiKey()).startsWith("aim_");

        AuthResponse tokens = authService.login("alice", "Abcd123!");
        assertThat(tokens.getExpiresInSeconds()).isEqualTo(86400);
        assertThat(tokens.getTokenType()).isEqualTo("Bearer");
        assertThat(tokens.getRefreshToken()).isNotBlank();

        UserPrincipal principal = authService.authenticateRequest(RequestCredentials.bearer(tokens.getAccessToken()));
        assertThat(principal.getUsername()).isEqualTo("alice");
        assertThat(principal.getRole()).isEqualTo(Role.USER);

        UserPrincipal byKey = authService.authenticateRequest(RequestCredentials.apiKey(registration.getApiKey()));
        assertThat(byKey.getUserId()).isEqualTo(registration.getUserId());

        UserPrincipal admin = UserPrincipal.of(fixture.createUser("root", Role.ADMIN));
        assertThat(fixture.adminService.toggleActive(admin, registration.getUserId())).isFalse();

        assertThatThrownBy(() -> authService.authenticateRequest(RequestCredentials.bearer(tokens.getAccessToken())))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.UNAUTHORIZED);
        assertThatThrownBy(() -> authService.login("alice", "Abcd123!"))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.ACCOUNT_INACTIVE);
    }

    @Test
    void register_NormalizesAndStoresProfile() {
        RegistrationResult result = authService.register("  Alice ", "Alice@X.com", "Abcd123!",
                new UserProfile("Alice Liddell", "Wonderland Ltd"));

        User stored = fixture.store.findById(result.getUserId()).orElseThrow();
        assertThat(stored.getUsername()).isEqualTo("Alice");
        assertThat(stored.getEmail()).isEqualTo("alice@x.com");
        assertThat(stored.getFullName()).isEqualTo("Alice Liddell");
        assertThat(stored.getCompany()).isEqualTo("Wonderland Ltd");
        assertThat(stored.getRole()).isEqualTo(Role.USER);
        assertThat(stored.isActive()).isTrue();
        assertThat(stored.getPasswordHash()).startsWith("$2").doesNotContain("Abcd123!");
        assertThat(stored.getApiKey()).isNotEqualTo(result.getApiKey());
        assertThat(stored.getCreatedAt()).isEqualTo(AuthTestFixture.START);
    }

    @Test
    void register_DuplicateUsernameIgnoringCase_UsernameTaken() {
        authService.register("alice", "alice@x.com", "Abcd123!", null);

        assertThatThrownBy(() -> authService.register("ALICE", "other@x.com", "Abcd123!", null))
                .isInstanceOf(RegistrationException.class)
                .extracting("kind").isEqualTo(RegistrationErrorKind.USERNAME_TAKEN);
    }

    @Test
    void register_DuplicateEmail_EmailTaken() {
        authService.register("alice", "alice@x.com", "Abcd123!", null);

        assertThatThrownBy(() -> authService.register("alice2", "ALICE@x.com", "Abcd123!", null))
                .isInstanceOf(RegistrationException.class)
                .extracting("kind").isEqualTo(RegistrationErrorKind.EMAIL_TAKEN);
    }

    @Test
    void register_WeakPassword_CarriesReason() {
        assertThatThrownBy(() -> authService.register("bob", "bob@x.com", "abcd123!", null))
                .isInstanceOf(RegistrationException.class)
                .hasMessage(PasswordRule.UPPERCASE.getReason())
                .extracting("kind").isEqualTo(RegistrationErrorKind.WEAK_PASSWORD);
        assertThat(fixture.store.count()).isZero();
    }

    @Test
    void register_InvalidEmail_Rejected() {
        assertThatThrownBy(() -> authService.register("bob", "not-an-email", "Abcd123!", null))
                .isInstanceOf(RegistrationException.class)
                .extracting("kind").isEqualTo(RegistrationErrorKind.INVALID_EMAIL);
    }

    @Test
    void register_UsernameShapedLikeAnotherUsersEmail_Rejected() {
        String aliceId = authService.register("alice", "alice@x.com", "Abcd123!", null).getUserId();

        assertThatThrownBy(() -> authService.register("alice@x.com", "mallory@x.com", "Abcd123!", null))
                .isInstanceOf(RegistrationException.class)
                .extracting("kind").isEqualTo(RegistrationErrorKind.INVALID_USERNAME);
        assertThat(fixture.store.findByIdentifier("alice@x.com")).map(User::getId).contains(aliceId);
        assertThat(authService.login("alice@x.com", "Abcd123!").getAccessToken()).isNotBlank();
    }

    @Test
    void register_MissingOrMalformedUsername_InvalidUsername() {
        for (String username : new String[] {null, "   ", "ab", "u".repeat(51), "bad name", "a@b"}) {
            assertThatThrownBy(() -> authService.register(username, "n@x.com", "Abcd123!", null))
                    .as("username %s", username)
                    .isInstanceOf(RegistrationException.class)
                    .extracting("kind").isEqualTo(RegistrationErrorKind.INVALID_USERNAME);
        }
        assertThat(fixture.store.count()).isZero();
    }

    @Test
    void register_OverlongEmailOrProfile_Rejected() {
        String longEmail = "a".repeat(95) + "@x.com";

        assertThatThrownBy(() -> authService.register("bob", longEmail, "Abcd123!", null))
                .isInstanceOf(RegistrationException.class)
                .extracting("kind").isEqualTo(RegistrationErrorKind.INVALID_EMAIL);
        assertThatThrownBy(() -> authService.register("bob", "bob@x.com", "Abcd123!",
                new UserProfile("n".repeat(101), null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void register_PasswordOver72Bytes_WeakPassword() {
        assertThatThrownBy(() -> authService.register("bob", "bob@x.com", "Abcd123!" + "x".repeat(65), null))
                .isInstanceOf(RegistrationException.class)
                .hasMessage(PasswordRule.MAX_LENGTH.getReason())
                .extracting("kind").isEqualTo(RegistrationErrorKind.WEAK_PASSWORD);
    }

    @Test
    void login_PasswordSharingStored72BytePrefix_InvalidCredentials() {
        String password = "Abcd123!" + "x".repeat(64);
        authService.register("bob", "bob@x.com", password, null);

        assertThatThrownBy(() -> authService.login("bob", password + "WRONG"))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.INVALID_CREDENTIALS);
        assertThat(authService.login("bob", password).getAccessToken()).isNotBlank();
    }

    @Test
    void register_ConcurrentSameUsername_ExactlyOneSucceeds() throws Exception {
        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RegistrationResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String email = "dave" + i + "@x.com";
                results.add(pool.submit(() -> {
                    start.await();
                    return authService.register("dave", email, "Abcd123!", null);
                }));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<RegistrationResult> result : results) {
                try {
                    result.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(RegistrationException.class);
                    assertThat(((RegistrationException) e.getCause()).getKind())
                            .isEqualTo(RegistrationErrorKind.USERNAME_TAKEN);
                }
            }
            assertThat(succeeded).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void login_ByEmail_UpdatesLastLogin() {
        String userId = authService.register("alice", "alice@x.com", "Abcd123!", null).getUserId();
        fixture.clock.advance(Duration.ofMinutes(5));

        authService.login("ALICE@x.com", "Abcd123!");

        assertThat(fixture.store.findById(userId).orElseThrow().getLastLogin())
                .isEqualTo(AuthTestFixture.START.plus(Duration.ofMinutes(5)));
    }

    @Test
    void login_WrongPasswordOrUnknownUser_InvalidCredentials() {
        authService.register("alice", "alice@x.com", "Abcd123!", null);

        assertThatThrownBy(() -> authService.login("alice", "Wrong123!"))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.INVALID_CREDENTIALS);
        assertThatThrownBy(() -> authService.login("nobody", "Abcd123!"))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.INVALID_CREDENTIALS);
    }

    @Test
    void login_InactiveWithWrongPassword_StillInvalidCredentials() {
        String userId = authService.register("alice", "alice@x.com", "Abcd123!", null).getUserId();
        fixture.store.setActive(userId, false);

        assertThatThrownBy(() -> authService.login("alice", "Wrong123!"))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.INVALID_CREDENTIALS);
    }

    @Test
    void login_LegacyHash_NeverVerifies() {
        User legacy = fixture.createUser("olduser", Role.USER);
        fixture.store.updatePassword(legacy.getId(),
                "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08", true);

        assertThatThrownBy(() -> authService.login("olduser", "test"))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.INVALID_CREDENTIALS);
    }

    @Test
    void refreshAccess_ReturnsNewAccessTokenAndSameRefreshToken() {
        authService.register("alice", "alice@x.com", "Abcd123!", null);
        AuthResponse tokens = authService.login("alice", "Abcd123!");

        AuthResponse refreshed = authService.refreshAccess(tokens.getRefreshToken());

        assertThat(refreshed.getRefreshToken()).isEqualTo(tokens.getRefreshToken());
        assertThat(refreshed.getAccessToken()).isNotEqualTo(tokens.getAccessToken());
        assertThat(fixture.tokenService.verify(refreshed.getAccessToken(), TokenType.ACCESS).getUsername())
                .isEqualTo("alice");
    }

    @Test
    void logout_RevokesAccessAndRefreshTokens() {
        authService.register("alice", "alice@x.com", "Abcd123!", null);
        AuthResponse tokens = authService.login("alice", "Abcd123!");
        UserPrincipal principal = authService.authenticateRequest(RequestCredentials.bearer(tokens.getAccessToken()));

        authService.logout(principal, tokens.getAccessToken(), tokens.getRefreshToken());

        assertThatThrownBy(() -> authService.authenticateRequest(RequestCredentials.bearer(tokens.getAccessToken())))
                .isInstanceOf(AuthException.class);
        assertThatThrownBy(() -> authService.refreshAccess(tokens.getRefreshToken()))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.TOKEN_REVOKED);
    }

    @Test
    void logout_SomeoneElsesRefreshToken_LeftValid() {
        authService.register("alice", "alice@x.com", "Abcd123!", null);
        authService.register("bob", "bob@x.com", "Abcd123!", null);
        AuthResponse aliceTokens = authService.login("alice", "Abcd123!");
        AuthResponse bobTokens = authService.login("bob", "Abcd123!");
        UserPrincipal bob = authService.authenticateRequest(RequestCredentials.bearer(bobTokens.getAccessToken()));

        authService.logout(bob, bobTokens.getAccessToken(), aliceTokens.getRefreshToken());

        assertThat(authService.refreshAccess(aliceTokens.getRefreshToken()).getAccessToken()).isNotBlank();
        assertThatThrownBy(() -> authService.authenticateRequest(RequestCredentials.bearer(bobTokens.getAccessToken())))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void login_SelfRegistered_NoPasswordChangeRequired() {
        authService.register("alice", "alice@x.com", "Abcd123!", null);

        assertThat(authService.login("alice", "Abcd123!").getPasswordChangeRequired()).isFalse();
    }

    @Test
    void changePassword_Success_OldPasswordStopsWorking() {
        String userId = authService.register("alice", "alice@x.com", "Abcd123!", null).getUserId();

        authService.changePassword(userId, "Abcd123!", "Efgh456?");

        assertThat(authService.login("alice", "Efgh456?").getAccessToken()).isNotBlank();
        assertThatThrownBy(() -> authService.login("alice", "Abcd123!"))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.INVALID_CREDENTIALS);
    }

    @Test
    void changePassword_WrongCurrent_InvalidCredentials() {
        String userId = authService.register("alice", "alice@x.com", "Abcd123!", null).getUserId();

        assertThatThrownBy(() -> authService.changePassword(userId, "Nope123!", "Efgh456?"))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.INVALID_CREDENTIALS);
    }

    @Test
    void changePassword_WeakOrUnchanged_Rejected() {
        String userId = authService.register("alice", "alice@x.com", "Abcd123!", null).getUserId();

        assertThatThrownBy(() -> authService.changePassword(userId, "Abcd123!", "short"))
                .isInstanceOf(PolicyViolationException.class);
        assertThatThrownBy(() -> authService.changePassword(userId, "Abcd123!", "Abcd123!"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void regenerateApiKey_OldKeyStopsWorking() {
        RegistrationResult registration = authService.register("alice", "alice@x.com", "Abcd123!", null);

        String newKey = authService.regenerateApiKey(registration.getUserId());

        assertThat(newKey).isNotEqualTo(registration.getApiKey());
        assertThat(authService.authenticateRequest(RequestCredentials.apiKey(newKey)).getUsername())
                .isEqualTo("alice");
        assertThatThrownBy(() -> authService.authenticateRequest(RequestCredentials.apiKey(registration.getApiKey())))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void profile_IncludesTodaysCallCount() {
        String userId = authService.register("alice", "alice@x.com", "Abcd123!", null).getUserId();
        fixture.store.appendUsage(UsageRecord.builder()
                .userId(userId)
                .endpoint("/auth/profile")
                .statusCode(200)
                .timestamp(AuthTestFixture.START)
                .build());

        ProfileResponse profile = authService.profile(new UserPrincipal(userId, "alice", Role.USER));

        assertThat(profile.getEmail()).isEqualTo("alice@x.com");
        assertThat(profile.getApiCallsToday()).isEqualTo(1);
    }
}
