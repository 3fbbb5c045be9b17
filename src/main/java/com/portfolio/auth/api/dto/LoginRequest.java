package com.portfolio.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Password login")
public record LoginRequest(
        @Schema(example = "ada@example.com")
        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email address")
        String email,

        @NotBlank(message = "Password is required")
        String password,

        @Schema(description = "Issue a 30-day token instead of a 7-day one")
        Boolean remember
) {

    public boolean rememberRequested() {
        return Boolean.TRUE.equals(remember);
    }
}
