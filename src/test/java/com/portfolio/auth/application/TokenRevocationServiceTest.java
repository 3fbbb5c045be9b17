package com.portfolio.auth.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.auth.config.AppProperties;
import com.portfolio.auth.config.JwtService;
import com.portfolio.auth.domain.Role;
import com.portfolio.auth.domain.TokenClaims;
import com.portfolio.auth.infrastructure.cache.InMemoryEphemeralStateCache;
import com.portfolio.auth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class TokenRevocationServiceTest {

    private MutableClock clock;
    private InMemoryEphemeralStateCache cache;
    private JwtService jwtService;
    private AppProperties props;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-04-10T09:00:00Z");
        cache = new InMemoryEphemeralStateCache(clock);
        jwtService = new JwtService("revocation-test-secret-at-least-32-bytes", 604800, 2592000, 86400,
                clock, new ObjectMapper());
        props = new AppProperties();
    }

    private TokenRevocationService service() {
        return new TokenRevocationService(cache, jwtService, clock, props);
    }

    private String token() {
        return jwtService.issue(TokenClaims.forIdentity("user-1", "a@b.c", Role.USER));
    }

    @Test
    void revokedTokenStaysRevokedUntilItWouldHaveExpired() {
        TokenRevocationService revocation = service();
        String token = token();

        revocation.revoke(token);

        assertThat(revocation.isRevoked(token)).isTrue();
        assertThat(cache.get(TokenRevocationService.KEY_PREFIX + token)).contains("true");

        clock.advance(Duration.ofDays(7).minusSeconds(1));
        assertThat(revocation.isRevoked(token)).isTrue();

        clock.advance(Duration.ofSeconds(1));
        assertThat(revocation.isRevoked(token)).isFalse();
    }

    @Test
    void markerLivesForRemainingTokenLifetime() {
        TokenRevocationService revocation = service();
        String token = token();
        clock.advance(Duration.ofDays(2));

        assertThat(revocation.markerTtl(token)).isEqualTo(Duration.ofDays(5));
    }

    @Test
    void markerFallsBackToOneHourWhenExpiryUnreadable() {
        assertThat(service().markerTtl("opaque-token")).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void otherTokensAreUnaffected() {
        TokenRevocationService revocation = service();
        String revoked = token();
        clock.advance(Duration.ofSeconds(1));
        String other = token();

        revocation.revoke(revoked);

        assertThat(revocation.isRevoked(other)).isFalse();
    }

    @Test
    void revokeDuringOutageDoesNotFailTheCaller() {
        TokenRevocationService revocation = service();
        String token = token();
        cache.close();

        assertThatCode(() -> revocation.revoke(token)).doesNotThrowAnyException();

        cache.connect();
        assertThat(revocation.isRevoked(token)).isFalse();
    }

    @Test
    void outageReadsAsNotRevokedWhenFailingOpen() {
        props.getAuth().getRevocation().setFailOpen(true);
        TokenRevocationService revocation = service();
        String token = token();
        revocation.revoke(token);

        cache.close();

        assertThat(revocation.isRevoked(token)).isFalse();
    }

    @Test
    void outageReadsAsRevokedWhenFailingClosed() {
        props.getAuth().getRevocation().setFailOpen(false);
        TokenRevocationService revocation = service();
        String token = token();

        cache.close();

        assertThat(revocation.isRevoked(token)).isTrue();
    }
}
