package com.portfolio.auth.application;

import com.portfolio.auth.config.JwtService;
import com.portfolio.auth.domain.AuthenticatedSession;
import com.portfolio.auth.domain.AuthenticatedUser;
import com.portfolio.auth.domain.TokenClaims;
import com.portfolio.auth.domain.ports.CredentialStore;
import com.portfolio.auth.exception.InvalidTokenException;
import com.portfolio.auth.exception.UnauthenticatedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Request-time authentication. Runs, in order and stopping at the first failure:
 * bearer extraction, revocation check, signature/expiry verification, user resolution
 * (cache first, then the credential store) and the active-account check.
 *
 * <p>Everything after extraction fails with the same message, so a caller cannot tell a
 * revoked token from an expired one, or a deleted account from a deactivated one.
 */
@Service
public class RequestAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(RequestAuthenticator.class);

    public static final String MISSING_TOKEN_MESSAGE = "Authentication required. Please log in.";
    public static final String INVALID_TOKEN_MESSAGE = "Invalid or expired token. Please log in again.";

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;
    private final TokenRevocationService revocationService;
    private final AuthenticatedUserCache userCache;
    private final CredentialStore credentialStore;

    public RequestAuthenticator(JwtService jwtService,
                                TokenRevocationService revocationService,
                                AuthenticatedUserCache userCache,
                                CredentialStore credentialStore) {
        this.jwtService = jwtService;
        this.revocationService = revocationService;
        this.userCache = userCache;
        this.credentialStore = credentialStore;
    }

    public AuthenticatedSession authenticate(String authorizationHeader) {
        String token = extractBearer(authorizationHeader);
        String fingerprint = TokenFingerprint.of(token);

        if (revocationService.isRevoked(token)) {
            log.info("Rejected revoked token {}", fingerprint);
            throw new UnauthenticatedException(INVALID_TOKEN_MESSAGE);
        }

        TokenClaims claims;
        try {
            claims = jwtService.verify(token);
        } catch (InvalidTokenException e) {
            log.info("Rejected token {}: {}", fingerprint, e.getMessage());
            throw new UnauthenticatedException(INVALID_TOKEN_MESSAGE, e);
        }

        AuthenticatedUser user = resolveUser(claims.subject())
                .orElseThrow(() -> {
                    log.info("Token {} refers to unknown user {}", fingerprint, claims.subject());
                    return new UnauthenticatedException(INVALID_TOKEN_MESSAGE);
                });

        if (!user.active()) {
            log.info("Token {} belongs to deactivated user {}", fingerprint, user.id());
            throw new UnauthenticatedException(INVALID_TOKEN_MESSAGE);
        }

        log.debug("Authenticated user {} with token {}", user.id(), fingerprint);
        return new AuthenticatedSession(user, token);
    }

    /**
     * Same pipeline, but any failure yields an anonymous caller instead of an error.
     */
    public Optional<AuthenticatedSession> authenticateOptionally(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(authenticate(authorizationHeader));
        } catch (UnauthenticatedException e) {
            log.debug("Optional authentication fell back to anonymous: {}", e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Optional authentication failed unexpectedly, continuing anonymous: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String extractBearer(String header) {
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            throw new UnauthenticatedException(MISSING_TOKEN_MESSAGE);
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new UnauthenticatedException(MISSING_TOKEN_MESSAGE);
        }
        return token;
    }

    private Optional<AuthenticatedUser> resolveUser(String subject) {
        UUID userId;
        try {
            userId = UUID.fromString(subject);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        Optional<AuthenticatedUser> cached = userCache.get(userId);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<AuthenticatedUser> loaded = credentialStore.findById(userId, false).map(AuthenticatedUser::from);
        loaded.ifPresent(userCache::put);
        return loaded;
    }
}
