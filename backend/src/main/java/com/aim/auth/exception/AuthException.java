package com.aim.auth.exception;

import lombok.Getter;

/**
 * Authentication or authorization failure carrying its {@link AuthErrorKind}.
 */
@Getter
public class AuthException extends RuntimeException {

    private final AuthErrorKind kind;

    public AuthException(AuthErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AuthException(AuthErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
