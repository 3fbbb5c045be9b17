package com.portfolio.auth.config;

import com.portfolio.auth.application.TwoFactorService;
import com.portfolio.auth.domain.AuthenticatedSession;
import com.portfolio.auth.domain.AuthenticatedUser;
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
import java.util.Set;

/**
 * Users with TOTP enabled may only make state-changing requests after a login-time
 * challenge has succeeded within the verified flag's lifetime. Reads are never gated.
 */
public class TwoFactorGateFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TwoFactorGateFilter.class);

    public static final String REQUIRED_MESSAGE = "Two-factor authentication required.";

    static final Set<String> STATE_CHANGING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    // Completing the challenge and giving up the session must stay possible
    static final Set<String> EXEMPT_PATHS = Set.of("/api/auth/totp/login-verify", "/api/auth/logout");

    private final TwoFactorService twoFactorService;
    private final ApiErrorWriter errorWriter;

    public TwoFactorGateFilter(TwoFactorService twoFactorService, ApiErrorWriter errorWriter) {
        this.twoFactorService = twoFactorService;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !STATE_CHANGING_METHODS.contains(request.getMethod().toUpperCase())
                || EXEMPT_PATHS.contains(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws IOException, ServletException {

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.getPrincipal() instanceof AuthenticatedSession session) {
            AuthenticatedUser user = session.user();
            if (user.twoFactorEnabled() && !twoFactorService.isSecondFactorVerified(user.id())) {
                log.warn("TwoFactorGate: Blocked {} {} for user {} pending TOTP verification",
                        request.getMethod(), request.getRequestURI(), user.id());
                errorWriter.write(request, response, HttpServletResponse.SC_FORBIDDEN, REQUIRED_MESSAGE);
                return;
            }
        }
        chain.doFilter(request, response);
    }
}
