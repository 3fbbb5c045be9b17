package com.portfolio.auth.domain;

/** Resolved identity plus the raw bearer token it was authenticated with. */
public record AuthenticatedSession(AuthenticatedUser user, String token) {
}
