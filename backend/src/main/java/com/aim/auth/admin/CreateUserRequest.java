package com.aim.auth.admin;

import com.aim.auth.model.Role;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for POST /admin/users. No password: one is generated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateUserRequest {

    @NotBlank(message = "Username is required")
    @Size(max = 50)
    private String username;

    @NotBlank(message = "Email is required")
    @Size(max = 100)
    private String email;

    @Size(max = 100)
    private String fullName;

    @Size(max = 100)
    private String company;

    @Builder.Default
    private Role role = Role.USER;
}
