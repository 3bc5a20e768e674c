package com.aim.auth.security;

import com.aim.auth.AuthTestFixture;
import com.aim.auth.exception.AuthErrorKind;
import com.aim.auth.exception.AuthException;
import com.aim.auth.model.Role;
import com.aim.auth.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiKeyServiceTest {

    private AuthTestFixture fixture;
    private ApiKeyService apiKeyService;
    private User alice;

    @BeforeEach
    void setUp() {
        fixture = new AuthTestFixture();
        apiKeyService = fixture.apiKeyService;
        alice = fixture.createUser("alice", Role.USER);
    }

    @Test
    void generateKey_HasPrefixAndIsUnique() {
        String first = apiKeyService.generateKey();
        String second = apiKeyService.generateKey();

        assertThat(first).startsWith("aim_").hasSize(4 + 43);
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void issue_StoresDigestNotPlaintext() {
        String key = apiKeyService.issue(alice.getId());

        assertThat(fixture.store.findByApiKey(key)).isEmpty();
        assertThat(fixture.store.findByApiKey(apiKeyService.digest(key))).isPresent();
        assertThat(apiKeyService.digest(key)).hasSize(64).isNotEqualTo(key);
    }

    @Test
    void authenticate_IssuedKey_ResolvesOwner() {
        String key = apiKeyService.issue(alice.getId());

        UserPrincipal principal = apiKeyService.authenticate(key);

        assertThat(principal.getUserId()).isEqualTo(alice.getId());
        assertThat(principal.getUsername()).isEqualTo("alice");
        assertThat(principal.getRole()).isEqualTo(Role.USER);
    }

    @Test
    void issue_ReplacesPreviousKey() {
        String oldKey = apiKeyService.issue(alice.getId());
        String newKey = apiKeyService.issue(alice.getId());

        assertThat(apiKeyService.authenticate(newKey).getUserId()).isEqualTo(alice.getId());
        assertThatThrownBy(() -> apiKeyService.authenticate(oldKey))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.INVALID_KEY);
    }

    @Test
    void authenticate_UnknownOrBlankKey_InvalidKey() {
        assertThatThrownBy(() -> apiKeyService.authenticate("aim_unknown"))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.INVALID_KEY);
        assertThatThrownBy(() -> apiKeyService.authenticate("  "))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.INVALID_KEY);
    }

    @Test
    void authenticate_InactiveOwner_UserInactive() {
        String key = apiKeyService.issue(alice.getId());
        fixture.store.setActive(alice.getId(), false);

        assertThatThrownBy(() -> apiKeyService.authenticate(key))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(AuthErrorKind.USER_INACTIVE);
    }
}
