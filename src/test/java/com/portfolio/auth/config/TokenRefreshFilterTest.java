package com.portfolio.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.auth.domain.AuthenticatedSession;
import com.portfolio.auth.domain.AuthenticatedUser;
import com.portfolio.auth.domain.Role;
import com.portfolio.auth.domain.TokenClaims;
import com.portfolio.auth.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class TokenRefreshFilterTest {

    private static final Instant ISSUED = Instant.parse("2026-09-01T00:00:00Z");

    private MutableClock clock;
    private JwtService jwtService;
    private TokenRefreshFilter filter;
    private AuthenticatedUser user;
    private String token;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(ISSUED);
        jwtService = new JwtService("refresh-filter-test-secret-of-32-bytes!", 604800, 2592000, 86400,
                clock, new ObjectMapper());
        filter = new TokenRefreshFilter(jwtService, clock);
        user = new AuthenticatedUser(UUID.randomUUID(), "ada@example.com", "Ada", "Lovelace", Role.USER,
                true, true, false, null);
        token = jwtService.issue(TokenClaims.forUser(user));
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private MockHttpServletResponse run(boolean authenticated) throws Exception {
        return run(authenticated, "GET", "/api/auth/me");
    }

    private MockHttpServletResponse run(boolean authenticated, String method, String uri) throws Exception {
        if (authenticated) {
            SecurityContextHolder.getContext().setAuthentication(
                    new UsernamePasswordAuthenticationToken(new AuthenticatedSession(user, token), null, List.of()));
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(new MockHttpServletRequest(method, uri), response, chain);
        assertThat(chain.getRequest()).isNotNull();
        return response;
    }

    @Test
    void freshTokenIsLeftAlone() throws Exception {
        clock.advance(Duration.ofDays(5));

        assertThat(run(true).getHeader(TokenRefreshFilter.NEW_TOKEN_HEADER)).isNull();
    }

    @Test
    void tokenInLastDayIsReplaced() throws Exception {
        clock.advance(Duration.ofDays(6).plusHours(12));

        String fresh = run(true).getHeader(TokenRefreshFilter.NEW_TOKEN_HEADER);

        assertThat(fresh).isNotNull().isNotEqualTo(token);
        TokenClaims claims = jwtService.verify(fresh);
        assertThat(claims.subject()).isEqualTo(user.id().toString());
        assertThat(claims.role()).isEqualTo(Role.USER);
        assertThat(claims.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofDays(7)));
        // The old token keeps working until its own expiry
        assertThat(jwtService.verify(token).subject()).isEqualTo(user.id().toString());
    }

    @Test
    void anonymousRequestsPassThrough() throws Exception {
        clock.advance(Duration.ofDays(6).plusHours(12));

        assertThat(run(false).getHeader(TokenRefreshFilter.NEW_TOKEN_HEADER)).isNull();
    }

    @Test
    void requestsThatRevokeTheTokenGetNoReplacement() throws Exception {
        clock.advance(Duration.ofDays(6).plusHours(12));

        assertThat(run(true, "POST", "/api/auth/logout").getHeader(TokenRefreshFilter.NEW_TOKEN_HEADER)).isNull();
        assertThat(run(true, "PUT", "/api/auth/change-password").getHeader(TokenRefreshFilter.NEW_TOKEN_HEADER)).isNull();
        assertThat(run(true, "POST", "/api/users/deactivate").getHeader(TokenRefreshFilter.NEW_TOKEN_HEADER)).isNull();
    }

    @Test
    void adminRoutesGetNoReplacement() throws Exception {
        clock.advance(Duration.ofDays(6).plusHours(12));

        assertThat(run(true, "GET", "/api/admin/users/" + user.id() + "/lockout")
                .getHeader(TokenRefreshFilter.NEW_TOKEN_HEADER)).isNull();
    }
}
