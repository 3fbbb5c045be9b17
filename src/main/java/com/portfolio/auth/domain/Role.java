package com.portfolio.auth.domain;

import java.util.Locale;

public enum Role {
    ADMIN,
    MANAGER,
    USER;

    /** Lowercase form carried in the token "role" claim and shown to clients. */
    public String claimValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Role fromClaim(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role value is required");
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
