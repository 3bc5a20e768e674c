package com.aim.auth.admin;

import com.aim.auth.auth.AuthService;
import com.aim.auth.auth.UserProfile;
import com.aim.auth.exception.RegistrationException;
import com.aim.auth.model.Role;
import com.aim.auth.store.UserStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the default administrator at startup when
 * {@code aim.bootstrap.admin.password} is set and no account with the
 * configured username exists yet.
 */
@Slf4j
@Component
public class AdminBootstrap implements ApplicationRunner {

    private final AuthService authService;
    private final UserStore userStore;
    private final String username;
    private final String email;
    private final String password;

    public AdminBootstrap(AuthService authService,
                          UserStore userStore,
                          @Value("${aim.bootstrap.admin.username:admin}") String username,
                          @Value("${aim.bootstrap.admin.email:admin@aim.com}") String email,
                          @Value("${aim.bootstrap.admin.password:}") String password) {
        this.authService = authService;
        this.userStore = userStore;
        this.username = username;
        this.email = email;
        this.password = password;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (password == null || password.isBlank()) {
            log.info("No bootstrap admin password configured; skipping admin creation");
            return;
        }
        if (userStore.findByIdentifier(username).isPresent()) {
            log.debug("Bootstrap admin '{}' already exists", username);
            return;
        }
        try {
            authService.createUser(username, email, password,
                    new UserProfile("Administrator", null), Role.ADMIN, true);
            log.info("Bootstrap admin '{}' created", username);
        } catch (RegistrationException e) {
            throw new IllegalStateException("Cannot create bootstrap admin: " + e.getMessage(), e);
        }
    }
}
