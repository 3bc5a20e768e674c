package com.aim.auth.exception;

public enum RegistrationErrorKind {
    USERNAME_TAKEN,
    EMAIL_TAKEN,
    WEAK_PASSWORD,
    INVALID_USERNAME,
    INVALID_EMAIL
}
