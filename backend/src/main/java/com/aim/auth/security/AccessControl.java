package com.aim.auth.security;

import com.aim.auth.exception.AuthErrorKind;
import com.aim.auth.exception.AuthException;
import com.aim.auth.model.Role;
import com.aim.auth.model.User;
import com.aim.auth.store.UserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resolves request credentials to a {@link UserPrincipal} and enforces roles.
 *
 * Callers only ever see {@link AuthErrorKind#UNAUTHORIZED}; the specific
 * reason (expired, revoked, unknown key...) goes to the log and stays
 * attached as the exception cause.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccessControl {

    private final TokenService tokenService;
    private final ApiKeyService apiKeyService;
    private final UserStore userStore;

    /**
     * @throws AuthException UNAUTHORIZED on any failure
     */
    public UserPrincipal authenticate(RequestCredentials credentials) {
        if (credentials == null || credentials.hasBearerToken() == credentials.hasApiKey()) {
            log.warn("Rejected request: expected exactly one of bearer token or API key");
            throw unauthorized(null);
        }
        try {
            return credentials.hasBearerToken()
                    ? fromBearerToken(credentials.getBearerToken())
                    : apiKeyService.authenticate(credentials.getApiKey());
        } catch (AuthException e) {
            log.warn("Rejected credential: {} ({})", e.getKind(), e.getMessage());
            throw unauthorized(e);
        }
    }

    /**
     * @throws AuthException FORBIDDEN when the principal lacks the role
     */
    public void requireRole(UserPrincipal principal, Role role) {
        if (principal == null || principal.getRole() != role) {
            log.warn("Forbidden: '{}' lacks role {}", principal == null ? null : principal.getUsername(), role);
            throw new AuthException(AuthErrorKind.FORBIDDEN, "Insufficient permissions");
        }
    }

    private UserPrincipal fromBearerToken(String token) {
        TokenClaims claims = tokenService.verify(token, TokenType.ACCESS);

        // deactivation must cut off live access tokens too
        User user = userStore.findById(claims.getUserId())
                .orElseThrow(() -> new AuthException(AuthErrorKind.USER_NOT_FOUND,
                        "Token subject no longer exists: " + claims.getUserId()));
        if (!user.isActive()) {
            throw new AuthException(AuthErrorKind.USER_INACTIVE, "Token subject is inactive: " + user.getUsername());
        }
        // role from the store, so a demotion applies to tokens already issued
        return UserPrincipal.of(user);
    }

    private static AuthException unauthorized(Throwable cause) {
        return new AuthException(AuthErrorKind.UNAUTHORIZED, "Unauthorized", cause);
    }
}
