package com.aim.auth.admin;

import com.aim.auth.model.Role;
import com.aim.auth.model.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * User row for the admin listing. Never carries the password hash or API key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSummary {

    private String id;
    private String username;
    private String email;
    private String fullName;
    private String company;
    private Role role;
    private boolean active;
    private boolean passwordChanged;
    private Instant createdAt;
    private Instant lastLogin;

    public static UserSummary from(User user) {
        return UserSummary.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .company(user.getCompany())
                .role(user.getRole())
                .active(user.isActive())
                .passwordChanged(user.isPasswordChanged())
                .createdAt(user.getCreatedAt())
                .lastLogin(user.getLastLogin())
                .build();
    }
}
