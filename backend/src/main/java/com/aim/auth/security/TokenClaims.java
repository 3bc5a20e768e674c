package com.aim.auth.security;

import com.aim.auth.model.Role;
import lombok.Value;

import java.time.Instant;

/**
 * Verified content of a JWT.
 */
@Value
public class TokenClaims {

    String tokenId;
    String username;
    String userId;
    Role role;
    TokenType type;
    Instant expiresAt;
}
