package com.aim.auth.exception;

import lombok.Getter;

/**
 * Registration rejected. The message is safe to show to the caller.
 */
@Getter
public class RegistrationException extends RuntimeException {

    private final RegistrationErrorKind kind;

    public RegistrationException(RegistrationErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RegistrationException(RegistrationErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isConflict() {
        return kind == RegistrationErrorKind.USERNAME_TAKEN || kind == RegistrationErrorKind.EMAIL_TAKEN;
    }
}
