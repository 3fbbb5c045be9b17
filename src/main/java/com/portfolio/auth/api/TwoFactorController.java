package com.portfolio.auth.api;

import com.portfolio.auth.api.dto.PasswordConfirmationRequest;
import com.portfolio.auth.api.dto.TotpCodeRequest;
import com.portfolio.auth.application.AuthorizationService;
import com.portfolio.auth.application.TwoFactorService;
import com.portfolio.auth.domain.AuthenticatedSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth/totp")
@Tag(name = "Two-Factor Authentication", description = "TOTP setup, verification and removal")
@SecurityRequirement(name = "Bearer Authentication")
public class TwoFactorController {

    private final TwoFactorService twoFactorService;
    private final AuthorizationService authorization;

    public TwoFactorController(TwoFactorService twoFactorService, AuthorizationService authorization) {
        this.twoFactorService = twoFactorService;
        this.authorization = authorization;
    }

    @GetMapping("/setup")
    @Operation(summary = "Start TOTP setup",
            description = "Returns a new secret, its otpauth URI and a QR code. The secret stays pending for 10 minutes.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Setup started"),
            @ApiResponse(responseCode = "400", description = "Two-factor authentication already enabled"),
            @ApiResponse(responseCode = "403", description = "Email not verified")
    })
    public ResponseEntity<ApiEnvelope<TwoFactorService.TwoFactorSetup>> setup(
            @AuthenticationPrincipal AuthenticatedSession session) {
        authorization.requireVerifiedEmail(session.user());
        return ResponseEntity.ok(ApiEnvelope.success("TOTP setup initialized successfully",
                twoFactorService.beginSetup(session.user())));
    }

    @PostMapping("/verify")
    @Operation(summary = "Confirm setup with a code and enable TOTP")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Two-factor authentication enabled"),
            @ApiResponse(responseCode = "400", description = "Setup expired or invalid code")
    })
    public ResponseEntity<ApiEnvelope<Void>> verifyAndEnable(@AuthenticationPrincipal AuthenticatedSession session,
                                                             @RequestBody @Valid TotpCodeRequest req) {
        authorization.requireVerifiedEmail(session.user());
        twoFactorService.verifyAndEnable(session.user(), req.token());
        return ResponseEntity.ok(ApiEnvelope.success("Two-factor authentication enabled successfully"));
    }

    @PostMapping("/disable")
    @Operation(summary = "Disable TOTP after re-entering the password")
    public ResponseEntity<ApiEnvelope<Void>> disable(@AuthenticationPrincipal AuthenticatedSession session,
                                                     @RequestBody @Valid PasswordConfirmationRequest req) {
        authorization.requireVerifiedEmail(session.user());
        twoFactorService.disable(session.user(), req.password());
        return ResponseEntity.ok(ApiEnvelope.success("Two-factor authentication disabled successfully"));
    }

    @PostMapping("/login-verify")
    @Operation(summary = "Complete the login-time TOTP challenge",
            description = "Unlocks state-changing requests for one hour.")
    public ResponseEntity<ApiEnvelope<Void>> loginVerify(@AuthenticationPrincipal AuthenticatedSession session,
                                                         @RequestBody @Valid TotpCodeRequest req) {
        twoFactorService.verifyLogin(session.user(), req.token());
        return ResponseEntity.ok(ApiEnvelope.success("Two-factor authentication verified successfully"));
    }
}
