package com.aim.auth.admin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of an admin-created account or password reset. The temporary
 * password (and, for new accounts, the API key) is shown only here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProvisionedUser {

    private String userId;
    private String username;
    private String temporaryPassword;
    private String apiKey;
}
