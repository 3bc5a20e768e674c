package com.aim.auth.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * One-way password hashing with BCrypt (fresh salt per call).
 *
 * <p>{@link #verify} never throws: a null input or a stored value that is not
 * a BCrypt hash is simply a non-match, so callers cannot tell a corrupt row
 * from a wrong password.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialHasher {

    private static final Pattern BCRYPT_PATTERN =
            Pattern.compile("^\\$2[aby]?\\$\\d\\d\\$[./0-9A-Za-z]{53}$");

    private final PasswordEncoder passwordEncoder;

    public String hash(String rawPassword) {
        return passwordEncoder.encode(rawPassword);
    }

    public boolean verify(String rawPassword, String storedHash) {
        if (rawPassword == null || storedHash == null) {
            return false;
        }
        // longer input would be truncated and compared on its prefix only
        if (rawPassword.getBytes(StandardCharsets.UTF_8).length > PasswordPolicy.MAX_BYTES) {
            return false;
        }
        if (isLegacyHash(storedHash)) {
            log.warn("Stored password is not a BCrypt hash; refusing to verify");
            return false;
        }
        try {
            return passwordEncoder.matches(rawPassword, storedHash);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed password hash: {}", e.getMessage());
            return false;
        }
    }

    /**
     * True for stored values written by the old fast-hash code paths
     * (e.g. a 64-char SHA-256 hex string). Such accounts need a password reset.
     */
    public boolean isLegacyHash(String storedHash) {
        return storedHash == null || !BCRYPT_PATTERN.matcher(storedHash).matches();
    }
}
