package com.aim.auth.exception;

import com.aim.auth.security.PasswordRule;
import lombok.Getter;

/**
 * A password failed {@link PasswordRule rule} of the password policy.
 */
@Getter
public class PolicyViolationException extends RuntimeException {

    private final PasswordRule rule;

    public PolicyViolationException(PasswordRule rule, String reason) {
        super(reason);
        this.rule = rule;
    }
}
