package com.portfolio.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record TotpCodeRequest(
        @Schema(example = "123456", description = "6-digit code from the authenticator app")
        @NotBlank(message = "TOTP token is required")
        @Pattern(regexp = "^[0-9]{6}$", message = "TOTP token must be exactly 6 digits")
        String token
) {
}
