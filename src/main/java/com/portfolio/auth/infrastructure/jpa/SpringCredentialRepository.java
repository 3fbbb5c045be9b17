package com.portfolio.auth.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface SpringCredentialRepository extends JpaRepository<CredentialEntity, UUID> {

    Optional<CredentialEntity> findByEmail(String email);

    boolean existsByEmail(String email);

    Optional<CredentialEntity> findByVerificationTokenHashAndVerificationTokenExpiresAfter(String tokenHash, Instant now);

    Optional<CredentialEntity> findByResetTokenHashAndResetTokenExpiresAfter(String tokenHash, Instant now);
}
