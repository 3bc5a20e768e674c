package com.aim.auth.auth;

import lombok.Value;

/**
 * Optional profile fields supplied at registration.
 */
@Value
public class UserProfile {

    public static final UserProfile EMPTY = new UserProfile(null, null);

    String fullName;
    String company;
}
