package com.portfolio.auth.api.dto;

import com.portfolio.auth.domain.AuthenticatedUser;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "Public view of the signed-in user")
public record UserView(
        UUID id,
        String firstName,
        String lastName,
        String email,
        @Schema(example = "user", allowableValues = {"admin", "manager", "user"}) String role,
        boolean verified,
        boolean twoFactorEnabled,
        Instant lastLogin
) {

    public static UserView of(AuthenticatedUser user) {
        return new UserView(
                user.id(),
                user.firstName(),
                user.lastName(),
                user.email(),
                user.role().claimValue(),
                user.verified(),
                user.twoFactorEnabled(),
                user.lastLogin());
    }
}
