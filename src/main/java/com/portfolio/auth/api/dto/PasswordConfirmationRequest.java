package com.portfolio.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/** Re-entry of the current password before a sensitive change. */
public record PasswordConfirmationRequest(
        @NotBlank(message = "Password is required")
        String password
) {
}
