package com.aim.auth.auth;

import com.aim.auth.security.UserPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * AuthController exposes the account endpoints:
 *
 *  POST /auth/register            → Register new account (public)
 *  POST /auth/login               → Login and receive JWT tokens (public)
 *  POST /auth/refresh             → Exchange refresh token for new access token (public)
 *  POST /auth/logout              → Revoke the presented tokens
 *  GET  /auth/profile             → Current user's profile and today's call count
 *  POST /auth/change-password     → Change password
 *  POST /auth/regenerate-api-key  → Replace the API key
 *
 * Failures are mapped to responses by GlobalExceptionHandler.
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;

    // ── POST /auth/register ───────────────────────────────────────────────

    @PostMapping("/register")
    public ResponseEntity<RegistrationResult> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Registration attempt for username: {}", request.getUsername());

        RegistrationResult result = authService.register(
                request.getUsername(),
                request.getEmail(),
                request.getPassword(),
                new UserProfile(request.getFullName(), request.getCompany())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    // ── POST /auth/login ──────────────────────────────────────────────────

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody AuthRequest request) {
        log.info("Login attempt for: {}", request.getIdentifier());
        return ResponseEntity.ok(authService.login(request.getIdentifier(), request.getPassword()));
    }

    // ── POST /auth/refresh ────────────────────────────────────────────────

    @PostMapping("/refresh")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        log.info("Token refresh attempt");
        return ResponseEntity.ok(authService.refreshAccess(request.getRefreshToken()));
    }

    // ── POST /auth/logout ─────────────────────────────────────────────────

    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(
            @AuthenticationPrincipal UserPrincipal principal,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) LogoutRequest request) {

        String accessToken = authorization != null && authorization.startsWith(BEARER_PREFIX)
                ? authorization.substring(BEARER_PREFIX.length()).trim()
                : null;
        authService.logout(principal, accessToken, request == null ? null : request.getRefreshToken());
        return ResponseEntity.ok(Map.of("message", "Logged out successfully."));
    }

    // ── GET /auth/profile ─────────────────────────────────────────────────

    @GetMapping("/profile")
    public ResponseEntity<ProfileResponse> profile(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(authService.profile(principal));
    }

    // ── POST /auth/change-password ────────────────────────────────────────

    @PostMapping("/change-password")
    public ResponseEntity<Map<String, String>> changePassword(
            @AuthenticationPrincipal UserPrincipal principal,
            @Valid @RequestBody ChangePasswordRequest request) {

        authService.changePassword(principal.getUserId(), request.getCurrentPassword(), request.getNewPassword());
        return ResponseEntity.ok(Map.of("message", "Password changed successfully."));
    }

    // ── POST /auth/regenerate-api-key ─────────────────────────────────────

    @PostMapping("/regenerate-api-key")
    public ResponseEntity<ApiKeyResponse> regenerateApiKey(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(new ApiKeyResponse(authService.regenerateApiKey(principal.getUserId())));
    }
}
