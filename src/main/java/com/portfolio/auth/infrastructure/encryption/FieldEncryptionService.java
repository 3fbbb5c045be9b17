package com.portfolio.auth.infrastructure.encryption;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * AES-256-GCM encryption for credential columns that must be readable again (the TOTP
 * shared secret), plus SHA-256 hashing for one-time tokens that only need lookups.
 */
@Service
public class FieldEncryptionService {

    private static final Logger log = LoggerFactory.getLogger(FieldEncryptionService.class);

    // AES-GCM configuration
    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12; // 96 bits
    private static final int GCM_TAG_LENGTH = 16; // 128 bits
    private static final int AES_KEY_LENGTH = 32; // 256 bits

    private final SecretKeySpec secretKey;
    private final int keyVersion;
    private final SecureRandom secureRandom;
    private final ObjectMapper objectMapper;

    public FieldEncryptionService(
            @Value("${app.encryption.key:}") String base64Key,
            @Value("${app.encryption.key-version:1}") int keyVersion,
            ObjectMapper objectMapper) {

        this.keyVersion = keyVersion;
        this.secureRandom = new SecureRandom();
        this.objectMapper = objectMapper;

        if (base64Key == null || base64Key.isBlank()) {
            throw new IllegalArgumentException("Encryption key is required. Set app.encryption.key property.");
        }

        try {
            byte[] decodedKey = Base64.getDecoder().decode(base64Key);
            if (decodedKey.length != AES_KEY_LENGTH) {
                throw new IllegalArgumentException(
                        String.format("Invalid key length: %d bytes. Expected %d bytes for AES-256.",
                                decodedKey.length, AES_KEY_LENGTH));
            }
            this.secretKey = new SecretKeySpec(decodedKey, ALGORITHM);
            log.info("Field encryption initialized - Algorithm: AES-256-GCM, KeyVersion: {}", keyVersion);
        } catch (IllegalArgumentException e) {
            log.error("Failed to initialize encryption key: {}", e.getMessage());
            throw new IllegalStateException("Invalid encryption key configuration", e);
        }
    }

    /**
     * Returns Base64 of a JSON envelope carrying key version, IV and ciphertext.
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            return null;
        }

        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] encryptedData = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            EncryptionEnvelope envelope = new EncryptionEnvelope(
                    keyVersion,
                    TRANSFORMATION,
                    Base64.getEncoder().encodeToString(iv),
                    Base64.getEncoder().encodeToString(encryptedData));

            String envelopeJson = objectMapper.writeValueAsString(envelope);
            return Base64.getEncoder().encodeToString(envelopeJson.getBytes(StandardCharsets.UTF_8));
        } catch (Exception e) {
            log.error("Encryption failed: {}", e.getMessage(), e);
            throw new EncryptionException("Failed to encrypt field", e);
        }
    }

    public String decrypt(String encryptedData) {
        if (encryptedData == null || encryptedData.isBlank()) {
            return null;
        }

        try {
            byte[] envelopeBytes = Base64.getDecoder().decode(encryptedData);
            EncryptionEnvelope envelope = objectMapper.readValue(
                    new String(envelopeBytes, StandardCharsets.UTF_8), EncryptionEnvelope.class);

            if (!TRANSFORMATION.equals(envelope.algorithm())) {
                throw new EncryptionException("Unsupported encryption algorithm: " + envelope.algorithm());
            }

            byte[] iv = Base64.getDecoder().decode(envelope.iv());
            byte[] ciphertext = Base64.getDecoder().decode(envelope.data());

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (EncryptionException e) {
            throw e;
        } catch (JsonProcessingException e) {
            log.error("Invalid encryption envelope format: {}", e.getMessage());
            throw new EncryptionException("Invalid encrypted data format", e);
        } catch (Exception e) {
            log.error("Decryption failed: {}", e.getMessage(), e);
            throw new EncryptionException("Failed to decrypt field", e);
        }
    }

    /**
     * SHA-256 hex digest. One-time tokens are stored and looked up by this value only.
     */
    public String generateHash(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            throw new EncryptionException("SHA-256 algorithm not available", e);
        }
    }

    public record EncryptionEnvelope(
            Integer keyVersion,
            String algorithm,
            String iv,
            String data
    ) {}

    public static class EncryptionException extends RuntimeException {
        public EncryptionException(String message) {
            super(message);
        }

        public EncryptionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
