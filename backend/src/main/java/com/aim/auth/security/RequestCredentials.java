package com.aim.auth.security;

import lombok.Value;

/**
 * Credential material presented with a request: a bearer token or an
 * API key. Exactly one must be set.
 */
@Value
public class RequestCredentials {

    String bearerToken;
    String apiKey;

    public static RequestCredentials bearer(String token) {
        return new RequestCredentials(token, null);
    }

    public static RequestCredentials apiKey(String apiKey) {
        return new RequestCredentials(null, apiKey);
    }

    public boolean hasBearerToken() {
        return bearerToken != null && !bearerToken.isBlank();
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
