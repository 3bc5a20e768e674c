package com.aim.auth.security;

import com.aim.auth.exception.PolicyViolationException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Password strength rules. Reports the first failing {@link PasswordRule}
 * so the message for a given password is always the same.
 */
@Component
public class PasswordPolicy {

    public static final int MIN_LENGTH = 8;
    /** BCrypt only reads the first 72 bytes of its input. */
    public static final int MAX_BYTES = 72;
    public static final String SPECIAL_CHARACTERS = "!@#$%^&*(),.?\":{}|<>";

    /**
     * @throws PolicyViolationException naming the first unmet rule
     */
    public void validate(String password) {
        if (password == null || password.length() < MIN_LENGTH) {
            throw violation(PasswordRule.LENGTH);
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) {
            throw violation(PasswordRule.MAX_LENGTH);
        }
        if (password.chars().noneMatch(Character::isUpperCase)) {
            throw violation(PasswordRule.UPPERCASE);
        }
        if (password.chars().noneMatch(Character::isLowerCase)) {
            throw violation(PasswordRule.LOWERCASE);
        }
        if (password.chars().noneMatch(Character::isDigit)) {
            throw violation(PasswordRule.DIGIT);
        }
        if (password.chars().noneMatch(c -> SPECIAL_CHARACTERS.indexOf(c) >= 0)) {
            throw violation(PasswordRule.SPECIAL);
        }
    }

    private static PolicyViolationException violation(PasswordRule rule) {
        return new PolicyViolationException(rule, rule.getReason());
    }
}
