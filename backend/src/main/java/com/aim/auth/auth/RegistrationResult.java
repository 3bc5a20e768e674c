package com.aim.auth.auth;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Returned by registration. The API key is shown only here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationResult {

    private String userId;
    private String apiKey;

    @Builder.Default
    private String message = "Registration successful. Save your API key securely!";
}
