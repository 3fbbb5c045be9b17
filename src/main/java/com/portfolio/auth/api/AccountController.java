package com.portfolio.auth.api;

import com.portfolio.auth.api.dto.PasswordConfirmationRequest;
import com.portfolio.auth.application.AuthService;
import com.portfolio.auth.domain.AuthenticatedSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@Tag(name = "Account", description = "Self-service account state")
@SecurityRequirement(name = "Bearer Authentication")
public class AccountController {

    private final AuthService authService;

    public AccountController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/deactivate")
    @Operation(summary = "Deactivate own account",
            description = "Requires the current password. The token used for this request is revoked.")
    public ResponseEntity<ApiEnvelope<Void>> deactivate(@AuthenticationPrincipal AuthenticatedSession session,
                                                        @RequestBody @Valid PasswordConfirmationRequest req) {
        authService.deactivate(session, req.password());
        return ResponseEntity.ok(ApiEnvelope.success("Account deactivated successfully"));
    }
}
