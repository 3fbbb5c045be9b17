package com.portfolio.auth.application;

import com.portfolio.auth.config.AppProperties;
import com.portfolio.auth.config.JwtService;
import com.portfolio.auth.domain.AuthenticatedSession;
import com.portfolio.auth.domain.AuthenticatedUser;
import com.portfolio.auth.domain.Credential;
import com.portfolio.auth.domain.LockoutPolicy;
import com.portfolio.auth.domain.LockoutStatus;
import com.portfolio.auth.domain.Role;
import com.portfolio.auth.domain.TokenClaims;
import com.portfolio.auth.domain.ports.AccountNotifierPort;
import com.portfolio.auth.domain.ports.CredentialStore;
import com.portfolio.auth.exception.AccountLockedException;
import com.portfolio.auth.exception.BadRequestException;
import com.portfolio.auth.exception.NotFoundException;
import com.portfolio.auth.exception.UnauthenticatedException;
import com.portfolio.auth.infrastructure.encryption.FieldEncryptionService;
import com.portfolio.auth.infrastructure.security.PasswordHashingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final String INVALID_CREDENTIALS_MESSAGE = "Invalid email or password";
    public static final String DEACTIVATED_MESSAGE = "Your account has been deactivated. Please contact support.";
    public static final String FORGOT_PASSWORD_MESSAGE =
            "If your email is registered, you will receive a password reset link shortly";

    private static final int ONE_TIME_TOKEN_BYTES = 32;

    private final CredentialStore credentialStore;
    private final PasswordHashingService passwordHashing;
    private final LockoutPolicy lockoutPolicy;
    private final JwtService jwtService;
    private final TokenRevocationService revocationService;
    private final AuthenticatedUserCache userCache;
    private final AccountNotifierPort notifier;
    private final FieldEncryptionService encryptionService;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    private final Duration verificationTtl;
    private final Duration resetTtl;
    private final String frontendUrl;

    public AuthService(CredentialStore credentialStore,
                       PasswordHashingService passwordHashing,
                       LockoutPolicy lockoutPolicy,
                       JwtService jwtService,
                       TokenRevocationService revocationService,
                       AuthenticatedUserCache userCache,
                       AccountNotifierPort notifier,
                       FieldEncryptionService encryptionService,
                       Clock clock,
                       AppProperties props) {
        this.credentialStore = credentialStore;
        this.passwordHashing = passwordHashing;
        this.lockoutPolicy = lockoutPolicy;
        this.jwtService = jwtService;
        this.revocationService = revocationService;
        this.userCache = userCache;
        this.notifier = notifier;
        this.encryptionService = encryptionService;
        this.clock = clock;
        this.verificationTtl = Duration.ofHours(props.getAuth().getVerificationTtlHours());
        this.resetTtl = Duration.ofMinutes(props.getAuth().getResetTtlMinutes());
        this.frontendUrl = props.getAuth().getFrontendUrl();
    }

    // ==========================================================================
    // REGISTRATION AND LOGIN
    // ==========================================================================

    public AuthResult register(String firstName, String lastName, String email, String password) {
        if (credentialStore.existsByEmail(email)) {
            log.warn("Registration rejected, email already in use: {}", email);
            throw new BadRequestException("User with this email already exists");
        }

        Credential credential = new Credential();
        credential.setFirstName(firstName.trim());
        credential.setLastName(lastName.trim());
        credential.setEmail(email);
        credential.setPasswordHash(passwordHashing.hash(password));
        credential.setRole(Role.USER);
        credential.setActive(true);
        credential.setVerified(false);

        String rawToken = newOneTimeToken();
        credential.setVerificationTokenHash(encryptionService.generateHash(rawToken));
        credential.setVerificationTokenExpires(clock.instant().plus(verificationTtl));

        credentialStore.save(credential);
        notifier.sendVerificationEmail(credential.getEmail(), credential.getFullName(),
                frontendUrl + "/verify-email?token=" + rawToken);

        AuthenticatedUser user = AuthenticatedUser.from(credential);
        String token = jwtService.issue(TokenClaims.forUser(user));
        log.info("Registered user {} ({})", user.id(), user.email());
        return new AuthResult(user, token, false);
    }

    /**
     * Password login. A locked credential is rejected before the password is looked at,
     * and wrong passwords are indistinguishable from unknown emails.
     */
    public AuthResult login(String email, String password, boolean remember) {
        Credential credential = credentialStore.findByEmail(email, true).orElse(null);
        if (credential == null) {
            passwordHashing.matchesNothing(password);
            log.warn("Login failed for unknown email: {}", email);
            throw new UnauthenticatedException(INVALID_CREDENTIALS_MESSAGE);
        }

        if (lockoutPolicy.checkLocked(credential)) {
            log.warn("Login refused for locked user {}", credential.getId());
            throw new AccountLockedException();
        }

        if (!passwordHashing.matches(password, credential.getPasswordHash())) {
            lockoutPolicy.recordFailure(credential);
            credentialStore.save(credential);
            userCache.evict(credential.getId());
            log.warn("Wrong password for user {} (attempt {})", credential.getId(), credential.getFailedLoginAttempts());
            throw new UnauthenticatedException(INVALID_CREDENTIALS_MESSAGE);
        }

        if (!credential.isActive()) {
            log.warn("Login refused for deactivated user {}", credential.getId());
            throw new UnauthenticatedException(DEACTIVATED_MESSAGE);
        }

        lockoutPolicy.recordSuccess(credential);
        credential.setLastLogin(clock.instant());
        credentialStore.save(credential);
        userCache.evict(credential.getId());

        AuthenticatedUser user = AuthenticatedUser.from(credential);
        String token = jwtService.issue(TokenClaims.forUser(user), jwtService.ttlFor(remember));
        log.info("User {} logged in (remember={}, twoFactor={})", user.id(), remember, user.twoFactorEnabled());
        return new AuthResult(user, token, credential.isTwoFactorEnabled());
    }

    public void logout(AuthenticatedSession session) {
        revocationService.revoke(session.token());
        log.info("User {} logged out", session.user().id());
    }

    public AuthenticatedUser currentUser(AuthenticatedSession session) {
        return credentialStore.findById(session.user().id(), false)
                .map(AuthenticatedUser::from)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    // ==========================================================================
    // EMAIL VERIFICATION
    // ==========================================================================

    public AuthenticatedUser verifyEmail(String rawToken) {
        Credential credential = credentialStore
                .findByVerificationTokenHash(encryptionService.generateHash(rawToken), clock.instant())
                .orElseThrow(() -> new BadRequestException("Invalid or expired verification token"));

        credential.setVerified(true);
        credential.setVerificationTokenHash(null);
        credential.setVerificationTokenExpires(null);
        credentialStore.save(credential);
        userCache.evict(credential.getId());

        log.info("Email verified for user {}", credential.getId());
        return AuthenticatedUser.from(credential);
    }

    public void resendVerification(AuthenticatedUser user) {
        Credential credential = credentialStore.findById(user.id(), false)
                .orElseThrow(() -> new NotFoundException("User not found"));
        if (credential.isVerified()) {
            throw new BadRequestException("Email is already verified");
        }

        String rawToken = newOneTimeToken();
        credential.setVerificationTokenHash(encryptionService.generateHash(rawToken));
        credential.setVerificationTokenExpires(clock.instant().plus(verificationTtl));
        credentialStore.save(credential);

        notifier.sendVerificationEmail(credential.getEmail(), credential.getFullName(),
                frontendUrl + "/verify-email?token=" + rawToken);
        log.info("Verification email re-sent for user {}", credential.getId());
    }

    // ==========================================================================
    // PASSWORD LIFECYCLE
    // ==========================================================================

    /**
     * Always succeeds from the caller's point of view, whether or not the account exists.
     */
    public void forgotPassword(String email) {
        Credential credential = credentialStore.findByEmail(email, false).orElse(null);
        if (credential == null || !credential.isActive()) {
            log.info("Password reset requested for unknown or inactive email: {}", email);
            return;
        }

        String rawToken = newOneTimeToken();
        credential.setResetTokenHash(encryptionService.generateHash(rawToken));
        credential.setResetTokenExpires(clock.instant().plus(resetTtl));
        credentialStore.save(credential);

        notifier.sendPasswordResetEmail(credential.getEmail(), credential.getFullName(),
                frontendUrl + "/reset-password?token=" + rawToken);
        log.info("Password reset token issued for user {}", credential.getId());
    }

    public void resetPassword(String rawToken, String newPassword) {
        UUID userId = credentialStore
                .findByResetTokenHash(encryptionService.generateHash(rawToken), clock.instant())
                .map(Credential::getId)
                .orElseThrow(() -> new BadRequestException("Invalid or expired password reset token"));

        Credential credential = loadWithSecrets(userId);
        credential.setPasswordHash(passwordHashing.hash(newPassword));
        credential.setResetTokenHash(null);
        credential.setResetTokenExpires(null);
        lockoutPolicy.recordSuccess(credential);
        credentialStore.save(credential);
        userCache.evict(userId);

        notifier.sendPasswordChangedEmail(credential.getEmail(), credential.getFullName());
        log.info("Password reset completed for user {}", userId);
    }

    /**
     * Changes the password and revokes the token the request was made with.
     */
    public void changePassword(AuthenticatedSession session, String currentPassword, String newPassword) {
        Credential credential = loadWithSecrets(session.user().id());
        if (!passwordHashing.matches(currentPassword, credential.getPasswordHash())) {
            log.warn("Password change rejected for user {}: current password mismatch", credential.getId());
            throw new BadRequestException("Current password is incorrect");
        }

        credential.setPasswordHash(passwordHashing.hash(newPassword));
        credentialStore.save(credential);
        userCache.evict(credential.getId());
        revocationService.revoke(session.token());

        notifier.sendPasswordChangedEmail(credential.getEmail(), credential.getFullName());
        log.info("Password changed for user {}", credential.getId());
    }

    // ==========================================================================
    // ACCOUNT STATE
    // ==========================================================================

    public void deactivate(AuthenticatedSession session, String password) {
        Credential credential = loadWithSecrets(session.user().id());
        if (!passwordHashing.matches(password, credential.getPasswordHash())) {
            log.warn("Deactivation rejected for user {}: wrong password", credential.getId());
            throw new BadRequestException("Invalid password");
        }

        credential.setActive(false);
        credentialStore.save(credential);
        userCache.evict(credential.getId());
        revocationService.revoke(session.token());
        log.info("User {} deactivated their account", credential.getId());
    }

    public LockoutStatus lockoutStatus(UUID userId) {
        Credential credential = credentialStore.findById(userId, false)
                .orElseThrow(() -> new NotFoundException("User not found"));
        return lockoutPolicy.statusOf(credential);
    }

    public LockoutStatus unlock(UUID userId) {
        Credential credential = credentialStore.findById(userId, false)
                .orElseThrow(() -> new NotFoundException("User not found"));
        lockoutPolicy.recordSuccess(credential);
        credentialStore.save(credential);
        userCache.evict(userId);
        log.info("Lockout cleared for user {}", userId);
        return lockoutPolicy.statusOf(credential);
    }

    private Credential loadWithSecrets(UUID userId) {
        return credentialStore.findById(userId, true)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    private String newOneTimeToken() {
        byte[] bytes = new byte[ONE_TIME_TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public record AuthResult(AuthenticatedUser user, String token, boolean requireTwoFactor) {
    }
}
