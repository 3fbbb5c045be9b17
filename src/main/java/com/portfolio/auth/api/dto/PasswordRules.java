package com.portfolio.auth.api.dto;

/** Shared password constraint: 8+ chars with upper, lower, digit and one of @$!%*?&. */
public final class PasswordRules {

    public static final String PATTERN = "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d)(?=.*[@$!%*?&])[A-Za-z\\d@$!%*?&]{8,}$";
    public static final String MESSAGE =
            "Password must contain at least one uppercase letter, one lowercase letter, one number, and one special character";

    private PasswordRules() {
    }
}
