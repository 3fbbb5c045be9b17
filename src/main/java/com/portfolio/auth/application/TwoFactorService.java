package com.portfolio.auth.application;

import com.portfolio.auth.config.AppProperties;
import com.portfolio.auth.domain.AuthenticatedUser;
import com.portfolio.auth.domain.Credential;
import com.portfolio.auth.domain.ports.CredentialStore;
import com.portfolio.auth.exception.BadRequestException;
import com.portfolio.auth.exception.InvalidTwoFactorCodeException;
import com.portfolio.auth.exception.MfaAlreadyConfiguredException;
import com.portfolio.auth.exception.NotFoundException;
import com.portfolio.auth.exception.TwoFactorSetupExpiredException;
import com.portfolio.auth.infrastructure.mfa.TOTPService;
import com.portfolio.auth.infrastructure.security.PasswordHashingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * TOTP second factor: DISABLED -> SETUP_PENDING -> ENABLED -> DISABLED.
 *
 * <p>The pending secret lives only in the cache ({@code totp_setup:<id>}, 10 minutes) until
 * a correct code moves it onto the credential. A successful login-time challenge sets
 * {@code totp_verified:<id>} for an hour, which the write gate requires from users who
 * have the factor enabled.
 */
@Service
public class TwoFactorService {

    private static final Logger log = LoggerFactory.getLogger(TwoFactorService.class);

    static final String SETUP_KEY_PREFIX = "totp_setup:";
    static final String VERIFIED_KEY_PREFIX = "totp_verified:";

    private final TOTPService totpService;
    private final ResilientStateCache cache;
    private final CredentialStore credentialStore;
    private final PasswordHashingService passwordHashing;
    private final AuthenticatedUserCache userCache;
    private final Duration setupTtl;
    private final Duration verifiedTtl;

    public TwoFactorService(TOTPService totpService,
                            ResilientStateCache cache,
                            CredentialStore credentialStore,
                            PasswordHashingService passwordHashing,
                            AuthenticatedUserCache userCache,
                            AppProperties props) {
        this.totpService = totpService;
        this.cache = cache;
        this.credentialStore = credentialStore;
        this.passwordHashing = passwordHashing;
        this.userCache = userCache;
        this.setupTtl = Duration.ofSeconds(props.getMfa().getSetupTtlSeconds());
        this.verifiedTtl = Duration.ofSeconds(props.getMfa().getVerifiedTtlSeconds());
    }

    /**
     * Starts (or restarts) setup with a fresh secret. The credential itself is not touched.
     */
    public TwoFactorSetup beginSetup(AuthenticatedUser user) {
        if (user.twoFactorEnabled()) {
            throw new MfaAlreadyConfiguredException();
        }

        String secret = totpService.generateSecret();
        String uri = totpService.createTotpUri(user.email(), secret);
        String qrCode = totpService.generateQrCodeDataUrl(uri);

        boolean stored = cache.writeQuietly(SETUP_KEY_PREFIX + user.id(), secret, setupTtl, "totp setup write");
        if (!stored) {
            log.warn("TOTP setup secret for user {} could not be cached; verification will report expiry", user.id());
        }

        log.info("TOTP setup started for user {}", user.id());
        return new TwoFactorSetup(secret, uri, qrCode);
    }

    /**
     * Enables the factor when the code matches the pending secret. A wrong code keeps the
     * pending secret so the user can retry until it expires.
     */
    public void verifyAndEnable(AuthenticatedUser user, String code) {
        String secret = cache.readOrEmpty(SETUP_KEY_PREFIX + user.id(), "totp setup read")
                .orElseThrow(TwoFactorSetupExpiredException::new);

        if (!totpService.verifyCode(secret, code)) {
            log.warn("Invalid TOTP code during setup for user {}", user.id());
            throw new InvalidTwoFactorCodeException("Invalid TOTP token. Please try again.");
        }

        Credential credential = loadWithSecrets(user.id());
        credential.setTwoFactorSecret(secret);
        credential.setTwoFactorEnabled(true);
        credentialStore.save(credential);

        cache.deleteQuietly(SETUP_KEY_PREFIX + user.id(), "totp setup delete");
        userCache.evict(user.id());
        log.info("Two-factor authentication enabled for user {}", user.id());
    }

    /**
     * Login-time challenge. Failures here do not count towards password lockout.
     */
    public void verifyLogin(AuthenticatedUser user, String code) {
        Credential credential = loadWithSecrets(user.id());
        if (!credential.isTwoFactorEnabled() || credential.getTwoFactorSecret() == null) {
            throw new BadRequestException("Two-factor authentication is not set up");
        }

        if (!totpService.verifyCode(credential.getTwoFactorSecret(), code)) {
            log.warn("Invalid TOTP code at login for user {}", user.id());
            throw new InvalidTwoFactorCodeException("Invalid TOTP token");
        }

        boolean stored = cache.writeQuietly(VERIFIED_KEY_PREFIX + user.id(), "true", verifiedTtl, "totp verified write");
        if (!stored) {
            log.warn("Second-factor verification for user {} could not be recorded; gated writes will be refused",
                    user.id());
        }
        log.info("Two-factor login verification succeeded for user {}", user.id());
    }

    /**
     * Turns the factor off after a full password check.
     */
    public void disable(AuthenticatedUser user, String password) {
        Credential credential = loadWithSecrets(user.id());
        if (!passwordHashing.matches(password, credential.getPasswordHash())) {
            log.warn("Wrong password when disabling 2FA for user {}", user.id());
            throw new BadRequestException("Password is incorrect");
        }

        credential.setTwoFactorEnabled(false);
        credential.setTwoFactorSecret(null);
        credentialStore.save(credential);

        cache.deleteQuietly(VERIFIED_KEY_PREFIX + user.id(), "totp verified delete");
        userCache.evict(user.id());
        log.info("Two-factor authentication disabled for user {}", user.id());
    }

    /**
     * Whether the user completed a login-time challenge within the flag's lifetime. An
     * unreachable cache reads as "not verified".
     */
    public boolean isSecondFactorVerified(UUID userId) {
        Optional<String> flag = cache.readOrEmpty(VERIFIED_KEY_PREFIX + userId, "totp verified read");
        return flag.map("true"::equals).orElse(false);
    }

    private Credential loadWithSecrets(UUID userId) {
        return credentialStore.findById(userId, true)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    public record TwoFactorSetup(String secret, String otpauthUri, String qrCode) {
    }
}
