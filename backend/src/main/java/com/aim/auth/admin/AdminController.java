package com.aim.auth.admin;

import com.aim.auth.auth.UserProfile;
import com.aim.auth.security.UserPrincipal;
import com.aim.auth.usage.UsageStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Admin-only endpoints. Role enforcement lives in AdminService.
 *
 *  GET  /admin/users                     → All users, newest first
 *  POST /admin/users                     → Create a user with a temporary password
 *  POST /admin/users/{id}/toggle         → Activate / deactivate
 *  POST /admin/users/{id}/reset-password → Issue a new temporary password
 *  PUT  /admin/users/{id}/role           → Change role
 *  GET  /admin/usage-stats?days=7        → Aggregate API usage
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminService adminService;

    @GetMapping("/users")
    public ResponseEntity<List<UserSummary>> listUsers(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(adminService.listUsers(principal));
    }

    @PostMapping("/users")
    public ResponseEntity<ProvisionedUser> createUser(
            @AuthenticationPrincipal UserPrincipal principal,
            @Valid @RequestBody CreateUserRequest request) {

        ProvisionedUser created = adminService.createUser(principal, request.getUsername(), request.getEmail(),
                new UserProfile(request.getFullName(), request.getCompany()), request.getRole());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping("/users/{userId}/reset-password")
    public ResponseEntity<ProvisionedUser> resetPassword(
            @AuthenticationPrincipal UserPrincipal principal,
            @PathVariable String userId) {

        return ResponseEntity.ok(adminService.resetPassword(principal, userId));
    }

    @PostMapping("/users/{userId}/toggle")
    public ResponseEntity<Map<String, Object>> toggleActive(
            @AuthenticationPrincipal UserPrincipal principal,
            @PathVariable String userId) {

        boolean active = adminService.toggleActive(principal, userId);
        return ResponseEntity.ok(Map.of(
                "userId", userId,
                "active", active,
                "message", active ? "User activated" : "User deactivated"
        ));
    }

    @PutMapping("/users/{userId}/role")
    public ResponseEntity<UserSummary> changeRole(
            @AuthenticationPrincipal UserPrincipal principal,
            @PathVariable String userId,
            @Valid @RequestBody RoleChangeRequest request) {

        return ResponseEntity.ok(adminService.changeRole(principal, userId, request.getRole()));
    }

    @GetMapping("/usage-stats")
    public ResponseEntity<UsageStats> usageStats(
            @AuthenticationPrincipal UserPrincipal principal,
            @RequestParam(defaultValue = "7") int days) {

        return ResponseEntity.ok(adminService.usageStats(principal, days));
    }
}
