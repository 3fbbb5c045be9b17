package com.portfolio.auth.config;

import com.portfolio.auth.application.RequestAuthenticator;
import com.portfolio.auth.domain.AuthenticatedSession;
import com.portfolio.auth.exception.UnauthenticatedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Bearer authentication for the API. Public endpoints are skipped, optional-auth
 * endpoints attach an identity when one can be established, and every other endpoint is
 * rejected with 401 unless the token passes {@link RequestAuthenticator}.
 */
public class JwtAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);

    static final Set<String> PUBLIC_PATHS = Set.of(
            "/api/auth/register",
            "/api/auth/login",
            "/api/auth/verify-email",
            "/api/auth/forgot-password",
            "/api/auth/reset-password",
            "/actuator/health",
            "/actuator/info");

    static final Set<String> OPTIONAL_AUTH_PATHS = Set.of("/api/auth/status");

    private final RequestAuthenticator authenticator;
    private final ApiErrorWriter errorWriter;

    public JwtAuthFilter(RequestAuthenticator authenticator, ApiErrorWriter errorWriter) {
        this.authenticator = authenticator;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest req) {
        String path = req.getRequestURI();

        // Skip OPTIONS requests completely
        if ("OPTIONS".equalsIgnoreCase(req.getMethod())) {
            return true;
        }

        if (PUBLIC_PATHS.contains(path)) {
            log.debug("JwtAuthFilter: Skipping public endpoint: {}", path);
            return true;
        }

        // Skip documentation endpoints
        return path.startsWith("/v3/api-docs") || path.startsWith("/swagger-ui") || path.equals("/swagger-ui.html");
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws IOException, ServletException {

        final String path = request.getRequestURI();
        final String method = request.getMethod();
        final String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (OPTIONAL_AUTH_PATHS.contains(path)) {
            Optional<AuthenticatedSession> session = authenticator.authenticateOptionally(authHeader);
            session.ifPresent(this::attach);
            log.debug("JwtAuthFilter: Optional auth for {} {} -> {}", method, path,
                    session.map(s -> s.user().id().toString()).orElse("anonymous"));
            chain.doFilter(request, response);
            return;
        }

        AuthenticatedSession session;
        try {
            session = authenticator.authenticate(authHeader);
        } catch (UnauthenticatedException e) {
            log.warn("JwtAuthFilter: Rejected {} {}: {}", method, path, e.getMessage());
            SecurityContextHolder.clearContext();
            errorWriter.write(request, response, HttpServletResponse.SC_UNAUTHORIZED, e.getMessage());
            return;
        }

        attach(session);
        log.debug("JwtAuthFilter: Authenticated user {} ({}) for {} {}",
                session.user().id(), session.user().role(), method, path);
        chain.doFilter(request, response);
    }

    private void attach(AuthenticatedSession session) {
        var authority = new SimpleGrantedAuthority("ROLE_" + session.user().role().name());
        var authentication = new UsernamePasswordAuthenticationToken(session, null, List.of(authority));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }
}
