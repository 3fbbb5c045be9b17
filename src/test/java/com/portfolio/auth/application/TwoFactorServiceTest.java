package com.portfolio.auth.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.auth.config.AppProperties;
import com.portfolio.auth.domain.AuthenticatedUser;
import com.portfolio.auth.domain.Credential;
import com.portfolio.auth.domain.Role;
import com.portfolio.auth.exception.BadRequestException;
import com.portfolio.auth.exception.InvalidTwoFactorCodeException;
import com.portfolio.auth.exception.MfaAlreadyConfiguredException;
import com.portfolio.auth.exception.TwoFactorSetupExpiredException;
import com.portfolio.auth.infrastructure.cache.InMemoryEphemeralStateCache;
import com.portfolio.auth.infrastructure.mfa.TOTPService;
import com.portfolio.auth.infrastructure.security.PasswordHashingService;
import com.portfolio.auth.support.InMemoryCredentialStore;
import com.portfolio.auth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TwoFactorServiceTest {

    private static final String PASSWORD = "Str0ng!Pass";

    private MutableClock clock;
    private InMemoryEphemeralStateCache cache;
    private InMemoryCredentialStore store;
    private TOTPService totp;
    private PasswordHashingService passwordHashing;
    private TwoFactorService twoFactor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-07-20T15:00:00Z");
        cache = new InMemoryEphemeralStateCache(clock);
        store = new InMemoryCredentialStore();
        totp = new TOTPService("Portfolio", 30, 1, 200, 200, clock);
        passwordHashing = new PasswordHashingService(new BCryptPasswordEncoder(4));

        AppProperties props = new AppProperties();
        ResilientStateCache resilient = new ResilientStateCache(cache);
        AuthenticatedUserCache userCache =
                new AuthenticatedUserCache(resilient, new ObjectMapper().findAndRegisterModules(), props);
        twoFactor = new TwoFactorService(totp, resilient, store, passwordHashing, userCache, props);
    }

    private AuthenticatedUser seedUser() {
        Credential c = new Credential();
        c.setEmail("alan@example.com");
        c.setFirstName("Alan");
        c.setLastName("Turing");
        c.setPasswordHash(passwordHashing.hash(PASSWORD));
        c.setRole(Role.USER);
        c.setVerified(true);
        return AuthenticatedUser.from(store.save(c));
    }

    private AuthenticatedUser reload(AuthenticatedUser user) {
        return AuthenticatedUser.from(store.stored(user.id()));
    }

    private AuthenticatedUser enrolled() {
        AuthenticatedUser user = seedUser();
        String secret = twoFactor.beginSetup(user).secret();
        twoFactor.verifyAndEnable(user, totp.currentCode(secret));
        return reload(user);
    }

    /** A well-formed code that matches none of the steps the verifier accepts right now. */
    private String wrongCode(String secret) {
        Set<String> accepted = Set.of(
                codeAt(secret, Duration.ofSeconds(-30)),
                codeAt(secret, Duration.ZERO),
                codeAt(secret, Duration.ofSeconds(30)));
        for (String candidate : new String[]{"000000", "111111", "222222", "333333"}) {
            if (!accepted.contains(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("no wrong code available");
    }

    private String codeAt(String secret, Duration offset) {
        clock.advance(offset);
        try {
            return totp.currentCode(secret);
        } finally {
            clock.advance(offset.negated());
        }
    }

    @Test
    void setupReturnsSecretUriAndQrCodeWithoutEnabling() {
        AuthenticatedUser user = seedUser();

        TwoFactorService.TwoFactorSetup setup = twoFactor.beginSetup(user);

        assertThat(setup.secret()).isNotBlank();
        assertThat(setup.otpauthUri()).contains("secret=" + setup.secret());
        assertThat(setup.qrCode()).startsWith("data:image/png;base64,");
        assertThat(cache.get(TwoFactorService.SETUP_KEY_PREFIX + user.id())).contains(setup.secret());
        assertThat(store.stored(user.id()).isTwoFactorEnabled()).isFalse();
    }

    @Test
    void correctCodeEnablesExactlyOnce() {
        AuthenticatedUser user = seedUser();
        String secret = twoFactor.beginSetup(user).secret();
        String code = totp.currentCode(secret);

        twoFactor.verifyAndEnable(user, code);

        Credential stored = store.stored(user.id());
        assertThat(stored.isTwoFactorEnabled()).isTrue();
        assertThat(stored.getTwoFactorSecret()).isEqualTo(secret);
        assertThat(cache.get(TwoFactorService.SETUP_KEY_PREFIX + user.id())).isEmpty();

        assertThatThrownBy(() -> twoFactor.verifyAndEnable(user, code))
                .isInstanceOf(TwoFactorSetupExpiredException.class);
    }

    @Test
    void wrongCodeKeepsPendingSecretForRetry() {
        AuthenticatedUser user = seedUser();
        String secret = twoFactor.beginSetup(user).secret();

        assertThatThrownBy(() -> twoFactor.verifyAndEnable(user, wrongCode(secret)))
                .isInstanceOf(InvalidTwoFactorCodeException.class)
                .hasMessage("Invalid TOTP token. Please try again.");
        assertThat(store.stored(user.id()).isTwoFactorEnabled()).isFalse();

        twoFactor.verifyAndEnable(user, totp.currentCode(secret));
        assertThat(store.stored(user.id()).isTwoFactorEnabled()).isTrue();
    }

    @Test
    void pendingSecretExpiresAfterTenMinutes() {
        AuthenticatedUser user = seedUser();
        String secret = twoFactor.beginSetup(user).secret();

        clock.advance(Duration.ofMinutes(10));

        assertThatThrownBy(() -> twoFactor.verifyAndEnable(user, totp.currentCode(secret)))
                .isInstanceOf(TwoFactorSetupExpiredException.class)
                .hasMessage("TOTP setup has expired. Please try again.");
    }

    @Test
    void restartingSetupReplacesPendingSecret() {
        AuthenticatedUser user = seedUser();
        String first = twoFactor.beginSetup(user).secret();
        String second = twoFactor.beginSetup(user).secret();

        assertThat(second).isNotEqualTo(first);
        assertThat(cache.get(TwoFactorService.SETUP_KEY_PREFIX + user.id())).contains(second);
    }

    @Test
    void setupIsRefusedOnceEnabled() {
        AuthenticatedUser user = enrolled();

        assertThatThrownBy(() -> twoFactor.beginSetup(user)).isInstanceOf(MfaAlreadyConfiguredException.class);
    }

    @Test
    void loginChallengeSetsVerifiedFlagForAnHour() {
        AuthenticatedUser user = enrolled();
        String secret = store.stored(user.id()).getTwoFactorSecret();
        assertThat(twoFactor.isSecondFactorVerified(user.id())).isFalse();

        twoFactor.verifyLogin(user, totp.currentCode(secret));

        assertThat(twoFactor.isSecondFactorVerified(user.id())).isTrue();
        clock.advance(Duration.ofHours(1));
        assertThat(twoFactor.isSecondFactorVerified(user.id())).isFalse();
    }

    @Test
    void loginChallengeRejectsWrongCode() {
        AuthenticatedUser user = enrolled();
        String secret = store.stored(user.id()).getTwoFactorSecret();

        assertThatThrownBy(() -> twoFactor.verifyLogin(user, wrongCode(secret)))
                .isInstanceOf(InvalidTwoFactorCodeException.class)
                .hasMessage("Invalid TOTP token");
        assertThat(twoFactor.isSecondFactorVerified(user.id())).isFalse();
        assertThat(store.stored(user.id()).getFailedLoginAttempts()).isZero();
    }

    @Test
    void loginChallengeRequiresEnabledFactor() {
        AuthenticatedUser user = seedUser();

        assertThatThrownBy(() -> twoFactor.verifyLogin(user, "123456"))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Two-factor authentication is not set up");
    }

    @Test
    void disableNeedsPasswordAndClearsEverything() {
        AuthenticatedUser user = enrolled();
        String secret = store.stored(user.id()).getTwoFactorSecret();
        twoFactor.verifyLogin(user, totp.currentCode(secret));

        assertThatThrownBy(() -> twoFactor.disable(user, "wrong"))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Password is incorrect");
        assertThat(store.stored(user.id()).isTwoFactorEnabled()).isTrue();

        twoFactor.disable(user, PASSWORD);

        Credential stored = store.stored(user.id());
        assertThat(stored.isTwoFactorEnabled()).isFalse();
        assertThat(stored.getTwoFactorSecret()).isNull();
        assertThat(twoFactor.isSecondFactorVerified(user.id())).isFalse();
    }

    @Test
    void cacheOutageReadsAsUnverifiedAndExpiredSetup() {
        AuthenticatedUser user = seedUser();
        cache.close();

        TwoFactorService.TwoFactorSetup setup = twoFactor.beginSetup(user);

        assertThat(setup.secret()).isNotBlank();
        assertThat(twoFactor.isSecondFactorVerified(user.id())).isFalse();
        assertThatThrownBy(() -> twoFactor.verifyAndEnable(user, totp.currentCode(setup.secret())))
                .isInstanceOf(TwoFactorSetupExpiredException.class);
    }
}
