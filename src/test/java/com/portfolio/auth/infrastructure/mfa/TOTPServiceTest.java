package com.portfolio.auth.infrastructure.mfa;

import com.portfolio.auth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TOTPServiceTest {

    private MutableClock clock;
    private TOTPService totpService;

    @BeforeEach
    void setUp() {
        // Aligned to the start of a 30 second step
        clock = MutableClock.at("2026-02-01T08:00:00Z");
        totpService = new TOTPService("Portfolio", 30, 1, 200, 200, clock);
    }

    @Test
    void shouldGenerateBase32Secret() {
        String secret = totpService.generateSecret();

        assertThat(secret).hasSize(32).matches("[A-Z2-7]+");
        assertThat(totpService.generateSecret()).isNotEqualTo(secret);
    }

    @Test
    void shouldAcceptCurrentCode() {
        String secret = totpService.generateSecret();

        assertThat(totpService.verifyCode(secret, totpService.currentCode(secret))).isTrue();
    }

    @Test
    void shouldTolerateOneStepOfDrift() {
        String secret = totpService.generateSecret();
        String code = totpService.currentCode(secret);

        clock.advance(Duration.ofSeconds(30));
        assertThat(totpService.verifyCode(secret, code)).isTrue();

        clock.advance(Duration.ofSeconds(60));
        assertThat(totpService.verifyCode(secret, code)).isFalse();
    }

    @Test
    void shouldRejectMalformedCodes() {
        String secret = totpService.generateSecret();

        assertThat(totpService.verifyCode(secret, "12345")).isFalse();
        assertThat(totpService.verifyCode(secret, "abcdef")).isFalse();
        assertThat(totpService.verifyCode(secret, null)).isFalse();
        assertThat(totpService.verifyCode(null, "123456")).isFalse();
    }

    @Test
    void shouldIssueAndAcceptOnlySixDigitCodes() {
        String secret = totpService.generateSecret();
        String code = totpService.currentCode(secret);

        assertThat(code).hasSize(TOTPService.CODE_DIGITS).matches("[0-9]+");
        assertThat(totpService.verifyCode(secret, code + "0")).isFalse();
        assertThat(totpService.verifyCode(secret, code.substring(1))).isFalse();
    }

    @Test
    void shouldBuildProvisioningUri() {
        String uri = totpService.createTotpUri("ada@example.com", "JBSWY3DPEHPK3PXP");

        assertThat(uri).startsWith("otpauth://totp/")
                .contains("secret=JBSWY3DPEHPK3PXP")
                .contains("issuer=Portfolio")
                .contains("digits=6")
                .contains("period=30");
    }

    @Test
    void shouldRenderQrCodeAsPngDataUrl() {
        String dataUrl = totpService.generateQrCodeDataUrl(
                totpService.createTotpUri("ada@example.com", totpService.generateSecret()));

        assertThat(dataUrl).startsWith("data:image/png;base64,");
    }
}
