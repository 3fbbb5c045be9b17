package com.portfolio.auth.infrastructure.encryption;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldEncryptionServiceTest {

    private static final String KEY = Base64.getEncoder().encodeToString(new byte[32]);

    private FieldEncryptionService encryption;

    @BeforeEach
    void setUp() {
        encryption = new FieldEncryptionService(KEY, 1, new ObjectMapper());
    }

    @Test
    void shouldDecryptWhatItEncrypted() {
        String cipherText = encryption.encrypt("JBSWY3DPEHPK3PXP");

        assertThat(cipherText).doesNotContain("JBSWY3DPEHPK3PXP");
        assertThat(encryption.decrypt(cipherText)).isEqualTo("JBSWY3DPEHPK3PXP");
    }

    @Test
    void shouldUseFreshIvPerEncryption() {
        assertThat(encryption.encrypt("same")).isNotEqualTo(encryption.encrypt("same"));
    }

    @Test
    void shouldPassNullsThrough() {
        assertThat(encryption.encrypt(null)).isNull();
        assertThat(encryption.decrypt(null)).isNull();
    }

    @Test
    void shouldHashDeterministically() {
        assertThat(encryption.generateHash("token")).isEqualTo(encryption.generateHash("token")).hasSize(64);
        assertThat(encryption.generateHash("token")).isNotEqualTo(encryption.generateHash("other"));
    }

    @Test
    void shouldRejectWrongKeyLength() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

        assertThatThrownBy(() -> new FieldEncryptionService(shortKey, 1, new ObjectMapper()))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new FieldEncryptionService("", 1, new ObjectMapper()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
