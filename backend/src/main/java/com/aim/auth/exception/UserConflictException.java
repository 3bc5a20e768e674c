package com.aim.auth.exception;

import lombok.Getter;

/**
 * Thrown by a user store when a create would break a uniqueness constraint.
 */
@Getter
public class UserConflictException extends RuntimeException {

    public enum Field { USERNAME, EMAIL, API_KEY }

    private final Field field;

    public UserConflictException(Field field) {
        super(String.format("User with this %s already exists", field.name().toLowerCase()));
        this.field = field;
    }

    public UserConflictException(Field field, Throwable cause) {
        super(String.format("User with this %s already exists", field.name().toLowerCase()), cause);
        this.field = field;
    }
}
