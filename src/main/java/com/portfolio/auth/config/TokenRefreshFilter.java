package com.portfolio.auth.config;

import com.portfolio.auth.domain.AuthenticatedSession;
import com.portfolio.auth.domain.TokenClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Soft refresh: when an authenticated request arrives with less than the refresh
 * threshold left on its token, a fresh token for the same identity is returned in
 * {@value #NEW_TOKEN_HEADER}. The old token is not revoked and stays valid until it expires.
 * <p>
 * Requests that revoke the presented token never get a replacement, and neither do admin
 * routes, whose role check runs after this filter.
 */
public class TokenRefreshFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TokenRefreshFilter.class);

    public static final String NEW_TOKEN_HEADER = "X-New-Token";

    private static final Set<String> REVOKING_ENDPOINTS = Set.of(
            "POST /api/auth/logout",
            "PUT /api/auth/change-password",
            "POST /api/users/deactivate"
    );

    private static final String ADMIN_PREFIX = "/api/admin/";

    private final JwtService jwtService;
    private final Clock clock;

    public TokenRefreshFilter(JwtService jwtService, Clock clock) {
        this.jwtService = jwtService;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest req) {
        String path = req.getRequestURI();
        if (REVOKING_ENDPOINTS.contains(req.getMethod() + " " + path)) {
            log.debug("TokenRefreshFilter: Skipping revoking endpoint: {} {}", req.getMethod(), path);
            return true;
        }
        return path.startsWith(ADMIN_PREFIX);
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws IOException, ServletException {

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.getPrincipal() instanceof AuthenticatedSession session) {
            try {
                refreshIfNearExpiry(session, response);
            } catch (RuntimeException e) {
                // A failed refresh must never fail the request itself
                log.error("Token refresh error for user {}: {}", session.user().id(), e.getMessage(), e);
            }
        }
        chain.doFilter(request, response);
    }

    private void refreshIfNearExpiry(AuthenticatedSession session, HttpServletResponse response) {
        // Identity was already verified upstream; the unverified read only feeds the timing decision
        Optional<Instant> expiry = jwtService.readExpiryUnverified(session.token());
        if (expiry.isEmpty()) {
            return;
        }
        Duration remaining = Duration.between(clock.instant(), expiry.get());
        if (remaining.compareTo(jwtService.getRefreshThreshold()) < 0) {
            String fresh = jwtService.issue(TokenClaims.forUser(session.user()));
            response.setHeader(NEW_TOKEN_HEADER, fresh);
            log.info("Issued refreshed token for user {} ({}s left on old token)",
                    session.user().id(), remaining.toSeconds());
        }
    }
}
