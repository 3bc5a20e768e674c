package com.aim.auth.exception;

/**
 * Distinguishable authentication failure kinds. Kept in server-side logs;
 * most of them are collapsed to {@link #UNAUTHORIZED} at the HTTP boundary.
 */
public enum AuthErrorKind {
    INVALID_CREDENTIALS,
    ACCOUNT_INACTIVE,
    TOKEN_EXPIRED,
    TOKEN_REVOKED,
    TOKEN_MALFORMED,
    WRONG_TOKEN_TYPE,
    INVALID_KEY,
    USER_NOT_FOUND,
    USER_INACTIVE,
    UNAUTHORIZED,
    FORBIDDEN
}
