package com.portfolio.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/** Carries the one-time token from a verification link. */
public record EmailTokenRequest(
        @NotBlank(message = "Token is required")
        String token
) {
}
