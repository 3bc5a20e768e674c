package com.aim.auth.security;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generates the one-time passwords handed out when an admin creates an
 * account or resets a password. Every result passes {@link PasswordPolicy}.
 */
@Component
public class TemporaryPasswordGenerator {

    static final int LENGTH = 12;

    private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    private static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String DIGITS = "0123456789";
    private static final String SPECIAL = "!@#$%&*";
    private static final String ALL = LOWER + UPPER + DIGITS + SPECIAL;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    public String generate() {
        List<Character> chars = new ArrayList<>(LENGTH);
        // one of each required class, then fill
        chars.add(pick(LOWER));
        chars.add(pick(UPPER));
        chars.add(pick(DIGITS));
        chars.add(pick(SPECIAL));
        while (chars.size() < LENGTH) {
            chars.add(pick(ALL));
        }
        Collections.shuffle(chars, SECURE_RANDOM);

        StringBuilder password = new StringBuilder(LENGTH);
        for (char c : chars) {
            password.append(c);
        }
        return password.toString();
    }

    private static char pick(String alphabet) {
        return alphabet.charAt(SECURE_RANDOM.nextInt(alphabet.length()));
    }
}
