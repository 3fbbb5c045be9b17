package com.portfolio.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.Objects;

public record ResetPasswordRequest(
        @NotBlank(message = "Token is required")
        String token,

        @NotBlank(message = "Password is required")
        @Pattern(regexp = PasswordRules.PATTERN, message = PasswordRules.MESSAGE)
        String password,

        @NotBlank(message = "Please confirm your password")
        String confirmPassword
) {

    @JsonIgnore
    @AssertTrue(message = "Passwords do not match")
    public boolean isConfirmPasswordMatching() {
        return confirmPassword == null || Objects.equals(password, confirmPassword);
    }
}
