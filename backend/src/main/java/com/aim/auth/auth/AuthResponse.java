package com.aim.auth.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response body returned after login or token refresh.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponse {

    private String accessToken;
    private String refreshToken;

    @Builder.Default
    private String tokenType = "Bearer";

    private long expiresInSeconds;   // access token lifetime

    /** Set on login only: true while the account still uses a temporary password. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean passwordChangeRequired;
}
