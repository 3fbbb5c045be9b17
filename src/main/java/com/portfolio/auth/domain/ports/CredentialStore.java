package com.portfolio.auth.domain.ports;

import com.portfolio.auth.domain.Credential;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface CredentialStore {

    /**
     * @param withSecretFields load the password hash and the TOTP secret as well
     */
    Optional<Credential> findByEmail(String email, boolean withSecretFields);

    Optional<Credential> findById(UUID id, boolean withSecretFields);

    /** Credential whose email-verification token hash matches and has not expired at {@code now}. */
    Optional<Credential> findByVerificationTokenHash(String tokenHash, Instant now);

    /** Credential whose password-reset token hash matches and has not expired at {@code now}. */
    Optional<Credential> findByResetTokenHash(String tokenHash, Instant now);

    boolean existsByEmail(String email);

    Credential save(Credential credential);
}
