package com.portfolio.auth.api;

import com.portfolio.auth.application.AuthService;
import com.portfolio.auth.application.AuthorizationService;
import com.portfolio.auth.domain.AuthenticatedSession;
import com.portfolio.auth.domain.LockoutStatus;
import com.portfolio.auth.domain.Role;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/admin/users")
@Tag(name = "Admin - Lockout", description = "Inspect and clear brute-force lockouts (ADMIN only)")
@SecurityRequirement(name = "Bearer Authentication")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final AuthService authService;
    private final AuthorizationService authorization;

    public AdminController(AuthService authService, AuthorizationService authorization) {
        this.authService = authService;
        this.authorization = authorization;
    }

    @GetMapping("/{id}/lockout")
    @Operation(summary = "Get lockout state of a user")
    public ResponseEntity<ApiEnvelope<LockoutStatus>> lockoutStatus(
            @AuthenticationPrincipal AuthenticatedSession session,
            @Parameter(description = "User id") @PathVariable("id") UUID userId) {
        authorization.requireRole(session.user(), Role.ADMIN);
        return ResponseEntity.ok(ApiEnvelope.success("Lockout status retrieved", authService.lockoutStatus(userId)));
    }

    @PostMapping("/{id}/unlock")
    @Operation(summary = "Clear failed attempts and any active lock")
    public ResponseEntity<ApiEnvelope<LockoutStatus>> unlock(
            @AuthenticationPrincipal AuthenticatedSession session,
            @Parameter(description = "User id") @PathVariable("id") UUID userId) {
        authorization.requireRole(session.user(), Role.ADMIN);
        log.info("Admin {} clearing lockout for user {}", session.user().id(), userId);
        return ResponseEntity.ok(ApiEnvelope.success("Lockout cleared", authService.unlock(userId)));
    }
}
