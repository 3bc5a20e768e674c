package com.aim.auth.security;

import com.aim.auth.exception.AuthErrorKind;
import com.aim.auth.exception.AuthException;
import com.aim.auth.model.User;
import com.aim.auth.store.UserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Long-lived API keys, the alternative to bearer tokens.
 *
 * <p>Keys are random 256-bit values with an {@code aim_} prefix. Only their
 * SHA-256 digest is stored, so the plaintext key is returned exactly once, by
 * {@link #issue}. A user has at most one live key: issuing a new one replaces
 * the old one. Keys have no expiry; they die on regeneration or when the
 * account is deactivated.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    static final String API_KEY_PREFIX = "aim_";
    private static final int KEY_LENGTH = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final UserStore userStore;

    /**
     * Generates a new key for the user and invalidates the previous one.
     *
     * @return the plaintext key
     */
    public String issue(String userId) {
        String apiKey = generateKey();
        userStore.updateApiKey(userId, digest(apiKey));
        log.info("API key regenerated for user id={}", userId);
        return apiKey;
    }

    /**
     * @throws AuthException INVALID_KEY for an unknown key, USER_INACTIVE for a deactivated owner
     */
    public UserPrincipal authenticate(String presentedKey) {
        if (presentedKey == null || presentedKey.isBlank()) {
            throw new AuthException(AuthErrorKind.INVALID_KEY, "API key is missing");
        }
        User user = userStore.findByApiKey(digest(presentedKey.trim()))
                .orElseThrow(() -> new AuthException(AuthErrorKind.INVALID_KEY, "Unknown API key"));
        if (!user.isActive()) {
            throw new AuthException(AuthErrorKind.USER_INACTIVE, "API key owner is inactive: " + user.getUsername());
        }
        return UserPrincipal.of(user);
    }

    /**
     * Generate a new API key with aim_ prefix.
     */
    public String generateKey() {
        byte[] randomBytes = new byte[KEY_LENGTH];
        SECURE_RANDOM.nextBytes(randomBytes);
        return API_KEY_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    /**
     * SHA-256 hex digest of a key, the value kept in the store.
     */
    public String digest(String apiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(apiKey.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not found", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }
}
