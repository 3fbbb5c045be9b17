package com.portfolio.auth.application;

import com.portfolio.auth.domain.AuthenticatedUser;
import com.portfolio.auth.domain.Role;
import com.portfolio.auth.exception.ForbiddenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Stateless gates applied after authentication. */
@Service
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    public static final String EMAIL_NOT_VERIFIED_MESSAGE =
            "Email verification required. Please verify your email address before proceeding.";

    public void requireRole(AuthenticatedUser user, Role... allowed) {
        if (allowed.length == 0 || Arrays.asList(allowed).contains(user.role())) {
            return;
        }
        String required = Arrays.stream(allowed).map(Role::claimValue).collect(Collectors.joining(" or "));
        log.warn("User {} with role {} denied, required: {}", user.id(), user.role(), required);
        throw new ForbiddenException("Access denied. Required role: " + required + ".");
    }

    public void requireVerifiedEmail(AuthenticatedUser user) {
        if (!user.verified()) {
            log.info("User {} blocked by email verification gate", user.id());
            throw new ForbiddenException(EMAIL_NOT_VERIFIED_MESSAGE);
        }
    }
}
