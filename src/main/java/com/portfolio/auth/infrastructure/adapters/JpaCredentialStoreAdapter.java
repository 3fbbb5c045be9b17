package com.portfolio.auth.infrastructure.adapters;

import com.portfolio.auth.domain.Credential;
import com.portfolio.auth.domain.ports.CredentialStore;
import com.portfolio.auth.infrastructure.encryption.FieldEncryptionService;
import com.portfolio.auth.infrastructure.jpa.CredentialEntity;
import com.portfolio.auth.infrastructure.jpa.SpringCredentialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaCredentialStoreAdapter implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCredentialStoreAdapter.class);

    private final SpringCredentialRepository credentials;
    private final FieldEncryptionService encryptionService;

    public JpaCredentialStoreAdapter(SpringCredentialRepository credentials, FieldEncryptionService encryptionService) {
        this.credentials = credentials;
        this.encryptionService = encryptionService;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Credential> findByEmail(String email, boolean withSecretFields) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return credentials.findByEmail(email.trim().toLowerCase()).map(e -> toDomain(e, withSecretFields));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Credential> findById(UUID id, boolean withSecretFields) {
        if (id == null) {
            return Optional.empty();
        }
        return credentials.findById(id).map(e -> toDomain(e, withSecretFields));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Credential> findByVerificationTokenHash(String tokenHash, Instant now) {
        return credentials.findByVerificationTokenHashAndVerificationTokenExpiresAfter(tokenHash, now)
                .map(e -> toDomain(e, false));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Credential> findByResetTokenHash(String tokenHash, Instant now) {
        return credentials.findByResetTokenHashAndResetTokenExpiresAfter(tokenHash, now)
                .map(e -> toDomain(e, false));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return email != null && credentials.existsByEmail(email.trim().toLowerCase());
    }

    @Override
    @Transactional
    public Credential save(Credential credential) {
        if (credential.getId() == null) {
            credential.setId(UUID.randomUUID());
        }

        CredentialEntity e = credentials.findById(credential.getId()).orElseGet(CredentialEntity::new);
        boolean isNew = e.getId() == null;
        e.setId(credential.getId());
        e.setEmail(credential.getEmail());
        e.setFirstName(credential.getFirstName());
        e.setLastName(credential.getLastName());
        e.setRole(credential.getRole());
        e.setActive(credential.isActive());
        e.setVerified(credential.isVerified());
        e.setLastLogin(credential.getLastLogin());
        e.setFailedLoginAttempts(credential.getFailedLoginAttempts());
        e.setLockUntil(credential.getLockUntil());
        e.setTwoFactorEnabled(credential.isTwoFactorEnabled());
        e.setVerificationTokenHash(credential.getVerificationTokenHash());
        e.setVerificationTokenExpires(credential.getVerificationTokenExpires());
        e.setResetTokenHash(credential.getResetTokenHash());
        e.setResetTokenExpires(credential.getResetTokenExpires());
        if (credential.getCreatedAt() != null) {
            e.setCreatedAt(credential.getCreatedAt());
        }

        // Secrets are only written when the caller actually loaded them
        if (credential.isSecretFieldsLoaded() || isNew) {
            e.setPasswordHash(credential.getPasswordHash());
            e.setTwoFactorSecretEncrypted(encryptionService.encrypt(credential.getTwoFactorSecret()));
        }

        CredentialEntity saved = credentials.save(e);
        credential.setCreatedAt(saved.getCreatedAt());
        log.debug("Saved credential {} (new={}, secrets written={})", saved.getId(), isNew,
                credential.isSecretFieldsLoaded() || isNew);
        return credential;
    }

    private Credential toDomain(CredentialEntity e, boolean withSecretFields) {
        Credential c = new Credential();
        c.setId(e.getId());
        c.setEmail(e.getEmail());
        c.setFirstName(e.getFirstName());
        c.setLastName(e.getLastName());
        c.setRole(e.getRole());
        c.setActive(e.isActive());
        c.setVerified(e.isVerified());
        c.setLastLogin(e.getLastLogin());
        c.setCreatedAt(e.getCreatedAt());
        c.setFailedLoginAttempts(e.getFailedLoginAttempts());
        c.setLockUntil(e.getLockUntil());
        c.setTwoFactorEnabled(e.isTwoFactorEnabled());
        c.setVerificationTokenHash(e.getVerificationTokenHash());
        c.setVerificationTokenExpires(e.getVerificationTokenExpires());
        c.setResetTokenHash(e.getResetTokenHash());
        c.setResetTokenExpires(e.getResetTokenExpires());
        c.setSecretFieldsLoaded(withSecretFields);
        if (withSecretFields) {
            c.setPasswordHash(e.getPasswordHash());
            c.setTwoFactorSecret(encryptionService.decrypt(e.getTwoFactorSecretEncrypted()));
        }
        return c;
    }
}
