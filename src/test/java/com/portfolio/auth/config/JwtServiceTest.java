package com.portfolio.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.auth.domain.Role;
import com.portfolio.auth.domain.TokenClaims;
import com.portfolio.auth.exception.InvalidTokenException;
import com.portfolio.auth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

    private static final String SECRET = "unit-test-secret-key-with-at-least-32-bytes";
    private static final Instant START = Instant.parse("2026-01-15T12:00:00Z");

    private MutableClock clock;
    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        jwtService = new JwtService(SECRET, 604800, 2592000, 86400, clock, new ObjectMapper());
    }

    @Test
    void shouldRoundTripIdentity() {
        String token = jwtService.issue(TokenClaims.forIdentity("user-1", "ada@example.com", Role.MANAGER));

        TokenClaims claims = jwtService.verify(token);

        assertThat(claims.subject()).isEqualTo("user-1");
        assertThat(claims.email()).isEqualTo("ada@example.com");
        assertThat(claims.role()).isEqualTo(Role.MANAGER);
        assertThat(claims.issuedAt()).isEqualTo(START);
        assertThat(claims.expiresAt()).isEqualTo(START.plus(Duration.ofDays(7)));
    }

    @Test
    void shouldAcceptUntilExpiryAndRejectAfter() {
        String token = jwtService.issue(TokenClaims.forIdentity("user-1", "ada@example.com", Role.USER));
        Instant expiry = START.plus(Duration.ofDays(7));

        clock.set(expiry.minusSeconds(1));
        assertThat(jwtService.verify(token).subject()).isEqualTo("user-1");

        clock.set(expiry.plusSeconds(1));
        assertThatThrownBy(() -> jwtService.verify(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void shouldUseLongerLifetimeWhenRemembered() {
        assertThat(jwtService.ttlFor(false)).isEqualTo(Duration.ofDays(7));
        assertThat(jwtService.ttlFor(true)).isEqualTo(Duration.ofDays(30));

        String token = jwtService.issue(TokenClaims.forIdentity("user-1", "a@b.c", Role.USER), jwtService.ttlFor(true));

        assertThat(jwtService.verify(token).expiresAt()).isEqualTo(START.plus(Duration.ofDays(30)));
    }

    @Test
    void shouldRejectTamperedToken() {
        String token = jwtService.issue(TokenClaims.forIdentity("user-1", "a@b.c", Role.USER));
        String adminToken = jwtService.issue(TokenClaims.forIdentity("user-1", "a@b.c", Role.ADMIN));

        // Payload of one token with the signature of another
        String[] original = token.split("\\.");
        String[] other = adminToken.split("\\.");
        String forged = original[0] + "." + other[1] + "." + original[2];

        assertThatThrownBy(() -> jwtService.verify(forged)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void shouldRejectTokenSignedWithAnotherSecret() {
        JwtService other = new JwtService("a-completely-different-secret-of-32-bytes!!", 604800, 2592000, 86400,
                clock, new ObjectMapper());
        String token = other.issue(TokenClaims.forIdentity("user-1", "a@b.c", Role.USER));

        assertThatThrownBy(() -> jwtService.verify(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void shouldRejectMalformedInput() {
        assertThatThrownBy(() -> jwtService.verify("not-a-jwt")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> jwtService.verify("")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> jwtService.verify(null)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void shouldRefuseShortSecret() {
        assertThatThrownBy(() -> new JwtService("too-short", 604800, 2592000, 86400, clock, new ObjectMapper()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldReadExpiryWithoutVerifying() {
        String token = jwtService.issue(TokenClaims.forIdentity("user-1", "a@b.c", Role.USER));
        clock.advance(Duration.ofDays(30));

        // Expired tokens still yield their expiry
        assertThat(jwtService.readExpiryUnverified(token)).contains(START.plus(Duration.ofDays(7)));
        assertThat(jwtService.readExpiryUnverified("garbage")).isEmpty();
        assertThat(jwtService.readExpiryUnverified("a.%%%.c")).isEmpty();
        assertThat(jwtService.readExpiryUnverified(null)).isEmpty();
    }
}
