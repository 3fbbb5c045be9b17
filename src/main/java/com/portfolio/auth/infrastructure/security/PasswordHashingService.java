package com.portfolio.auth.infrastructure.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Salted one-way hashing over the configured {@link PasswordEncoder} (BCrypt). BCrypt's
 * own comparison is constant-time.
 */
@Service
public class PasswordHashingService {

    private static final Logger log = LoggerFactory.getLogger(PasswordHashingService.class);

    private final PasswordEncoder encoder;
    private final String dummyHash;

    public PasswordHashingService(PasswordEncoder encoder) {
        this.encoder = encoder;
        this.dummyHash = encoder.encode("timing-equalizer-not-a-password");
    }

    public String hash(String rawPassword) {
        return encoder.encode(rawPassword);
    }

    public boolean matches(String rawPassword, String passwordHash) {
        if (rawPassword == null || passwordHash == null || passwordHash.isBlank()) {
            return false;
        }
        try {
            return encoder.matches(rawPassword, passwordHash);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password hash could not be parsed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Burns one comparison against a fixed hash so unknown accounts take as long to
     * reject as wrong passwords. Always false.
     */
    public boolean matchesNothing(String rawPassword) {
        encoder.matches(rawPassword == null ? "" : rawPassword, dummyHash);
        return false;
    }
}
