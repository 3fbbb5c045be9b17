package com.portfolio.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.Objects;

@Schema(description = "New account registration")
public record RegisterRequest(
        @Schema(example = "Ada")
        @NotBlank(message = "First name is required")
        @Size(min = 2, max = 50, message = "First name must be between 2 and 50 characters")
        String firstName,

        @Schema(example = "Lovelace")
        @NotBlank(message = "Last name is required")
        @Size(min = 2, max = 50, message = "Last name must be between 2 and 50 characters")
        String lastName,

        @Schema(example = "ada@example.com")
        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email address")
        String email,

        @Schema(example = "Str0ng!Pass")
        @NotBlank(message = "Password is required")
        @Pattern(regexp = PasswordRules.PATTERN, message = PasswordRules.MESSAGE)
        String password,

        @NotBlank(message = "Please confirm your password")
        String confirmPassword,

        @NotNull(message = "You must accept the terms and conditions")
        @AssertTrue(message = "You must accept the terms and conditions")
        Boolean termsAccepted
) {

    @JsonIgnore
    @AssertTrue(message = "Passwords do not match")
    public boolean isConfirmPasswordMatching() {
        return confirmPassword == null || Objects.equals(password, confirmPassword);
    }
}
