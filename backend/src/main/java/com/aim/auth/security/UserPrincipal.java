package com.aim.auth.security;

import com.aim.auth.model.Role;
import com.aim.auth.model.User;
import lombok.Value;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;

/**
 * Authenticated identity resolved from a credential. Produced once per
 * request by {@link AccessControl} and never mutated afterwards.
 */
@Value
public class UserPrincipal {

    String userId;
    String username;
    Role role;

    public static UserPrincipal of(User user) {
        return new UserPrincipal(user.getId(), user.getUsername(), user.getRole());
    }

    public List<GrantedAuthority> authorities() {
        return List.of(new SimpleGrantedAuthority(role.authority()));
    }
}
