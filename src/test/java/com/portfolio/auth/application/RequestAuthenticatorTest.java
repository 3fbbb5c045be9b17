package com.portfolio.auth.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.auth.config.AppProperties;
import com.portfolio.auth.config.JwtService;
import com.portfolio.auth.domain.AuthenticatedSession;
import com.portfolio.auth.domain.AuthenticatedUser;
import com.portfolio.auth.domain.Credential;
import com.portfolio.auth.domain.Role;
import com.portfolio.auth.domain.TokenClaims;
import com.portfolio.auth.exception.UnauthenticatedException;
import com.portfolio.auth.infrastructure.cache.InMemoryEphemeralStateCache;
import com.portfolio.auth.support.InMemoryCredentialStore;
import com.portfolio.auth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestAuthenticatorTest {

    private MutableClock clock;
    private InMemoryEphemeralStateCache cache;
    private InMemoryCredentialStore store;
    private JwtService jwtService;
    private AppProperties props;
    private AuthenticatedUserCache userCache;
    private TokenRevocationService revocation;
    private RequestAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-06-01T12:00:00Z");
        cache = new InMemoryEphemeralStateCache(clock);
        store = new InMemoryCredentialStore();
        props = new AppProperties();
        jwtService = new JwtService("authenticator-test-secret-32-bytes-long!", 604800, 2592000, 86400,
                clock, new ObjectMapper());
        rebuild();
    }

    private void rebuild() {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        userCache = new AuthenticatedUserCache(new ResilientStateCache(cache), mapper, props);
        revocation = new TokenRevocationService(cache, jwtService, clock, props);
        authenticator = new RequestAuthenticator(jwtService, revocation, userCache, store);
    }

    private Credential seedUser(boolean active) {
        Credential c = new Credential();
        c.setEmail("grace@example.com");
        c.setFirstName("Grace");
        c.setLastName("Hopper");
        c.setPasswordHash("irrelevant");
        c.setRole(Role.MANAGER);
        c.setActive(active);
        c.setVerified(true);
        return store.save(c);
    }

    private String bearer(Credential c) {
        return "Bearer " + jwtService.issue(TokenClaims.forUser(AuthenticatedUser.from(c)));
    }

    @Test
    void shouldAuthenticateValidBearerToken() {
        Credential user = seedUser(true);
        String header = bearer(user);

        AuthenticatedSession session = authenticator.authenticate(header);

        assertThat(session.user().id()).isEqualTo(user.getId());
        assertThat(session.user().role()).isEqualTo(Role.MANAGER);
        assertThat(session.token()).isEqualTo(header.substring("Bearer ".length()));
        assertThat(userCache.get(user.getId())).isPresent();
    }

    @Test
    void shouldRequireBearerScheme() {
        assertThatThrownBy(() -> authenticator.authenticate(null))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage(RequestAuthenticator.MISSING_TOKEN_MESSAGE);
        assertThatThrownBy(() -> authenticator.authenticate("Basic dXNlcjpwYXNz"))
                .hasMessage(RequestAuthenticator.MISSING_TOKEN_MESSAGE);
        assertThatThrownBy(() -> authenticator.authenticate("Bearer   "))
                .hasMessage(RequestAuthenticator.MISSING_TOKEN_MESSAGE);
    }

    @Test
    void shouldRejectRevokedToken() {
        String header = bearer(seedUser(true));
        revocation.revoke(header.substring("Bearer ".length()));

        assertThatThrownBy(() -> authenticator.authenticate(header))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage(RequestAuthenticator.INVALID_TOKEN_MESSAGE);
    }

    @Test
    void shouldRejectExpiredToken() {
        String header = bearer(seedUser(true));
        clock.advance(Duration.ofDays(8));

        assertThatThrownBy(() -> authenticator.authenticate(header))
                .hasMessage(RequestAuthenticator.INVALID_TOKEN_MESSAGE);
    }

    @Test
    void shouldRejectTokenForUnknownUser() {
        String token = jwtService.issue(TokenClaims.forIdentity(UUID.randomUUID().toString(), "x@y.z", Role.USER));

        assertThatThrownBy(() -> authenticator.authenticate("Bearer " + token))
                .hasMessage(RequestAuthenticator.INVALID_TOKEN_MESSAGE);
    }

    @Test
    void shouldRejectTokenForDeactivatedUserWithSameMessage() {
        String header = bearer(seedUser(false));

        assertThatThrownBy(() -> authenticator.authenticate(header))
                .hasMessage(RequestAuthenticator.INVALID_TOKEN_MESSAGE);
    }

    @Test
    void shouldServeUserFromCacheOnceResolved() {
        Credential user = seedUser(true);
        String header = bearer(user);
        authenticator.authenticate(header);

        store.clear();

        assertThat(authenticator.authenticate(header).user().email()).isEqualTo("grace@example.com");
    }

    @Test
    void optionalAuthenticationFallsBackToAnonymous() {
        String header = bearer(seedUser(true));

        assertThat(authenticator.authenticateOptionally(null)).isEmpty();
        assertThat(authenticator.authenticateOptionally("Bearer not-a-token")).isEmpty();
        assertThat(authenticator.authenticateOptionally(header)).isPresent();
    }

    @Test
    void cacheOutageFailingOpenStillAuthenticates() {
        Credential user = seedUser(true);
        String header = bearer(user);
        cache.close();

        assertThat(authenticator.authenticate(header).user().id()).isEqualTo(user.getId());
    }

    @Test
    void cacheOutageFailingClosedRejects() {
        props.getAuth().getRevocation().setFailOpen(false);
        rebuild();
        String header = bearer(seedUser(true));
        cache.close();

        assertThatThrownBy(() -> authenticator.authenticate(header))
                .hasMessage(RequestAuthenticator.INVALID_TOKEN_MESSAGE);
    }
}
