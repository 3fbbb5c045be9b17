package com.portfolio.auth.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Secret-free projection of a {@link Credential}. This is what gets cached under
 * {@code user:{id}} and attached to an authenticated request.
 */
public record AuthenticatedUser(
        UUID id,
        String email,
        String firstName,
        String lastName,
        Role role,
        boolean active,
        boolean verified,
        boolean twoFactorEnabled,
        Instant lastLogin
) {

    public static AuthenticatedUser from(Credential credential) {
        return new AuthenticatedUser(
                credential.getId(),
                credential.getEmail(),
                credential.getFirstName(),
                credential.getLastName(),
                credential.getRole(),
                credential.isActive(),
                credential.isVerified(),
                credential.isTwoFactorEnabled(),
                credential.getLastLogin());
    }
}
