package com.portfolio.auth.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Brute-force lockout rules applied to a {@link Credential}.
 *
 * <p>A credential is locked while its lock expiry lies in the future. Callers must check
 * {@link #checkLocked(Credential)} before comparing a password; a locked credential is
 * rejected without the password ever being evaluated.
 */
public class LockoutPolicy {

    private static final Logger log = LoggerFactory.getLogger(LockoutPolicy.class);

    private final int maxAttempts;
    private final Duration lockDuration;
    private final Clock clock;

    public LockoutPolicy(int maxAttempts, Duration lockDuration, Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (lockDuration == null || lockDuration.isNegative() || lockDuration.isZero()) {
            throw new IllegalArgumentException("lockDuration must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.lockDuration = lockDuration;
        this.clock = clock;
    }

    public boolean checkLocked(Credential credential) {
        Instant lockUntil = credential.getLockUntil();
        return lockUntil != null && lockUntil.isAfter(clock.instant());
    }

    public Credential recordFailure(Credential credential) {
        Instant now = clock.instant();

        // A lock that has already run out starts a fresh series of attempts
        if (credential.getLockUntil() != null && !credential.getLockUntil().isAfter(now)) {
            credential.setFailedLoginAttempts(1);
            credential.setLockUntil(null);
            log.debug("Expired lock cleared for credential {}, attempt counter restarted", credential.getId());
            return credential;
        }

        int attempts = credential.getFailedLoginAttempts() + 1;
        credential.setFailedLoginAttempts(attempts);

        if (attempts >= maxAttempts && credential.getLockUntil() == null) {
            Instant lockUntil = now.plus(lockDuration);
            credential.setLockUntil(lockUntil);
            log.warn("Credential {} locked until {} after {} failed attempts", credential.getId(), lockUntil, attempts);
        } else {
            log.debug("Failed attempt {} of {} recorded for credential {}", attempts, maxAttempts, credential.getId());
        }
        return credential;
    }

    public Credential recordSuccess(Credential credential) {
        credential.setFailedLoginAttempts(0);
        credential.setLockUntil(null);
        return credential;
    }

    public LockoutStatus statusOf(Credential credential) {
        return new LockoutStatus(credential.getFailedLoginAttempts(), credential.getLockUntil(), checkLocked(credential));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getLockDuration() {
        return lockDuration;
    }
}
