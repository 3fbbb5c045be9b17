package com.portfolio.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.Objects;

public record ChangePasswordRequest(
        @NotBlank(message = "Current password is required")
        String currentPassword,

        @NotBlank(message = "New password is required")
        @Pattern(regexp = PasswordRules.PATTERN, message = PasswordRules.MESSAGE)
        String newPassword,

        @NotBlank(message = "Please confirm your new password")
        String confirmPassword
) {

    @JsonIgnore
    @AssertTrue(message = "Passwords do not match")
    public boolean isConfirmPasswordMatching() {
        return confirmPassword == null || Objects.equals(newPassword, confirmPassword);
    }
}
