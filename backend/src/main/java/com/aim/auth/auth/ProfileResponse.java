package com.aim.auth.auth;

import com.aim.auth.model.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for GET /auth/profile
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {

    private String userId;
    private String username;
    private String email;
    private String fullName;
    private String company;
    private Role role;
    private Instant createdAt;
    private Instant lastLogin;
    private boolean passwordChanged;
    private long apiCallsToday;
}
