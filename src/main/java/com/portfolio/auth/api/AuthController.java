package com.portfolio.auth.api;

import com.portfolio.auth.api.dto.ChangePasswordRequest;
import com.portfolio.auth.api.dto.EmailTokenRequest;
import com.portfolio.auth.api.dto.ForgotPasswordRequest;
import com.portfolio.auth.api.dto.LoginRequest;
import com.portfolio.auth.api.dto.RegisterRequest;
import com.portfolio.auth.api.dto.ResetPasswordRequest;
import com.portfolio.auth.api.dto.SessionView;
import com.portfolio.auth.api.dto.UserView;
import com.portfolio.auth.application.AuthService;
import com.portfolio.auth.domain.AuthenticatedSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/auth")
@Tag(name = "Authentication", description = "Registration, login, logout and password lifecycle")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @Operation(summary = "Register a new account",
            description = "Creates an unverified USER account, sends a verification email and returns a 7-day token.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "400", description = "Email already registered"),
            @ApiResponse(responseCode = "422", description = "Validation failed")
    })
    public ResponseEntity<ApiEnvelope<SessionView>> register(@RequestBody @Valid RegisterRequest req) {
        log.info("Registration attempt for: {}", req.email());
        AuthService.AuthResult result = authService.register(req.firstName(), req.lastName(), req.email(), req.password());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiEnvelope.success("User registered successfully. Please verify your email.",
                        new SessionView(UserView.of(result.user()), result.token(), null)));
    }

    @PostMapping("/login")
    @Operation(
            summary = "Authenticate with email and password",
            description = """
                    Returns a bearer token (7 days, or 30 days with `remember`).

                    When `requireTwoFactor` is true the token is valid for reads, but state-changing
                    requests are refused until `/api/auth/totp/login-verify` succeeds.

                    After 5 consecutive wrong passwords the account is locked for one hour.
                    """)
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authenticated",
                    content = @Content(mediaType = "application/json", examples = @ExampleObject(value = """
                            {
                                "status": "success",
                                "message": "Login successful",
                                "data": {
                                    "user": { "email": "ada@example.com", "role": "user", "twoFactorEnabled": true },
                                    "token": "eyJhbGciOiJIUzI1NiJ9...",
                                    "requireTwoFactor": true
                                }
                            }
                            """))),
            @ApiResponse(responseCode = "401", description = "Invalid credentials, account locked or deactivated",
                    content = @Content(mediaType = "application/json", examples = @ExampleObject(value = """
                            {
                                "status": "fail",
                                "message": "Invalid email or password",
                                "path": "/api/auth/login"
                            }
                            """)))
    })
    public ResponseEntity<ApiEnvelope<SessionView>> login(@RequestBody @Valid LoginRequest req) {
        log.info("Login attempt for user: {}", req.email());
        AuthService.AuthResult result = authService.login(req.email(), req.password(), req.rememberRequested());
        return ResponseEntity.ok(ApiEnvelope.success("Login successful",
                new SessionView(UserView.of(result.user()), result.token(), result.requireTwoFactor())));
    }

    @PostMapping("/logout")
    @Operation(summary = "Revoke the current token")
    @SecurityRequirement(name = "Bearer Authentication")
    public ResponseEntity<ApiEnvelope<Void>> logout(@AuthenticationPrincipal AuthenticatedSession session) {
        authService.logout(session);
        return ResponseEntity.ok(ApiEnvelope.success("Logged out successfully"));
    }

    @GetMapping("/me")
    @Operation(summary = "Get the current user")
    @SecurityRequirement(name = "Bearer Authentication")
    public ResponseEntity<ApiEnvelope<UserView>> me(@AuthenticationPrincipal AuthenticatedSession session) {
        return ResponseEntity.ok(ApiEnvelope.success("User profile retrieved successfully",
                UserView.of(authService.currentUser(session))));
    }

    @GetMapping("/status")
    @Operation(summary = "Session status",
            description = "Works with or without a token. An invalid token is treated as no token.")
    public ResponseEntity<ApiEnvelope<Map<String, Object>>> status(
            @AuthenticationPrincipal AuthenticatedSession session) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("authenticated", session != null);
        if (session != null) {
            body.put("user", UserView.of(session.user()));
        }
        return ResponseEntity.ok(ApiEnvelope.success("Session status", body));
    }

    // ==========================================================================
    // EMAIL VERIFICATION
    // ==========================================================================

    @PostMapping("/verify-email")
    @Operation(summary = "Confirm an email address with the token from the verification link")
    public ResponseEntity<ApiEnvelope<UserView>> verifyEmail(@RequestBody @Valid EmailTokenRequest req) {
        return ResponseEntity.ok(ApiEnvelope.success("Email verified successfully",
                UserView.of(authService.verifyEmail(req.token()))));
    }

    @PostMapping("/resend-verification")
    @Operation(summary = "Send a new verification email")
    @SecurityRequirement(name = "Bearer Authentication")
    public ResponseEntity<ApiEnvelope<Void>> resendVerification(@AuthenticationPrincipal AuthenticatedSession session) {
        authService.resendVerification(session.user());
        return ResponseEntity.ok(ApiEnvelope.success("Verification email sent successfully"));
    }

    // ==========================================================================
    // PASSWORD LIFECYCLE
    // ==========================================================================

    @PostMapping("/forgot-password")
    @Operation(summary = "Request a password reset link",
            description = "Always answers with the same message, whether or not the email is registered.")
    public ResponseEntity<ApiEnvelope<Void>> forgotPassword(@RequestBody @Valid ForgotPasswordRequest req) {
        authService.forgotPassword(req.email());
        return ResponseEntity.ok(ApiEnvelope.success(AuthService.FORGOT_PASSWORD_MESSAGE));
    }

    @PostMapping("/reset-password")
    @Operation(summary = "Set a new password with a reset token")
    public ResponseEntity<ApiEnvelope<Void>> resetPassword(@RequestBody @Valid ResetPasswordRequest req) {
        authService.resetPassword(req.token(), req.password());
        return ResponseEntity.ok(ApiEnvelope.success("Password has been reset successfully. Please log in."));
    }

    @PutMapping("/change-password")
    @Operation(summary = "Change password", description = "The token used for this request is revoked.")
    @SecurityRequirement(name = "Bearer Authentication")
    public ResponseEntity<ApiEnvelope<Void>> changePassword(@AuthenticationPrincipal AuthenticatedSession session,
                                                            @RequestBody @Valid ChangePasswordRequest req) {
        authService.changePassword(session, req.currentPassword(), req.newPassword());
        return ResponseEntity.ok(ApiEnvelope.success("Password changed successfully. Please log in again."));
    }
}
