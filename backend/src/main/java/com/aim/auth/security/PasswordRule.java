package com.aim.auth.security;

/**
 * Password policy rules, in the order they are checked.
 */
public enum PasswordRule {
    LENGTH("Password must be at least 8 characters long"),
    MAX_LENGTH("Password must be at most 72 bytes long"),
    UPPERCASE("Password must contain at least one uppercase letter"),
    LOWERCASE("Password must contain at least one lowercase letter"),
    DIGIT("Password must contain at least one digit"),
    SPECIAL("Password must contain at least one special character");

    private final String reason;

    PasswordRule(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
