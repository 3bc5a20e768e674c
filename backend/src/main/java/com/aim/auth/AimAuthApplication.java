package com.aim.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

/**
 * AIM Platform authentication service.
 * Main entry point for the Spring Boot application.
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class AimAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(AimAuthApplication.class, args);
    }
}
