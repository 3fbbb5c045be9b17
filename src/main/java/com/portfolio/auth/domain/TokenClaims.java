package com.portfolio.auth.domain;

import java.time.Instant;

/**
 * Identity carried by a bearer token. {@code issuedAt} and {@code expiresAt} are null on
 * claims built for issuing and populated on claims read back from a verified token.
 */
public record TokenClaims(
        String subject,
        String email,
        Role role,
        Instant issuedAt,
        Instant expiresAt
) {

    public static TokenClaims forIdentity(String subject, String email, Role role) {
        return new TokenClaims(subject, email, role, null, null);
    }

    public static TokenClaims forUser(AuthenticatedUser user) {
        return forIdentity(user.id().toString(), user.email(), user.role());
    }
}
