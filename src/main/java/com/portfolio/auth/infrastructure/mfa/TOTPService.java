package com.portfolio.auth.infrastructure.mfa;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.DefaultCodeVerifier;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.exceptions.CodeGenerationException;
import dev.samstevens.totp.qr.QrData;
import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;
import dev.samstevens.totp.time.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.util.Base64;

@Service
public class TOTPService {

    private static final Logger log = LoggerFactory.getLogger(TOTPService.class);

    /** Fixed code length; request validation in {@code TotpCodeRequest} accepts exactly this many digits. */
    public static final int CODE_DIGITS = 6;

    private static final String CODE_PATTERN = "^[0-9]{" + CODE_DIGITS + "}$";

    // Configuration from application.yml
    private final String issuerName;
    private final int periodSeconds;
    private final int qrWidth;
    private final int qrHeight;

    private final SecretGenerator secretGenerator;
    private final TimeProvider timeProvider;
    private final CodeGenerator codeGenerator;
    private final DefaultCodeVerifier codeVerifier;

    public TOTPService(
            @Value("${app.mfa.totp.issuer-name:Portfolio}") String issuerName,
            @Value("${app.mfa.totp.period-seconds:30}") int periodSeconds,
            @Value("${app.mfa.totp.window-size:1}") int windowSize,
            @Value("${app.mfa.qr-code.width:300}") int qrWidth,
            @Value("${app.mfa.qr-code.height:300}") int qrHeight,
            Clock clock) {

        this.issuerName = issuerName;
        this.periodSeconds = periodSeconds;
        this.qrWidth = qrWidth;
        this.qrHeight = qrHeight;

        this.secretGenerator = new DefaultSecretGenerator();
        // Time steps follow the service clock so tests can pin the current step
        this.timeProvider = () -> clock.instant().getEpochSecond();
        this.codeGenerator = new DefaultCodeGenerator(HashingAlgorithm.SHA1, CODE_DIGITS);

        this.codeVerifier = new DefaultCodeVerifier(codeGenerator, timeProvider);
        this.codeVerifier.setTimePeriod(periodSeconds);
        this.codeVerifier.setAllowedTimePeriodDiscrepancy(windowSize);

        log.info("TOTP Service initialized - Issuer: {}, Digits: {}, Period: {}s, Window: {}",
                issuerName, CODE_DIGITS, periodSeconds, windowSize);
    }

    /**
     * Generate a new base32 shared secret
     */
    public String generateSecret() {
        String secret = secretGenerator.generate();
        log.debug("Generated new TOTP secret of length: {} characters", secret.length());
        return secret;
    }

    /**
     * otpauth:// provisioning URI understood by authenticator apps
     */
    public String createTotpUri(String email, String secret) {
        QrData data = new QrData.Builder()
                .label(email)
                .secret(secret)
                .issuer(issuerName)
                .algorithm(HashingAlgorithm.SHA1)
                .digits(CODE_DIGITS)
                .period(periodSeconds)
                .build();
        log.debug("Generated TOTP URI for user: {}", email);
        return data.getUri();
    }

    /**
     * Render the provisioning URI as a PNG QR code data URL
     */
    public String generateQrCodeDataUrl(String totpUri) {
        try {
            QRCodeWriter qrCodeWriter = new QRCodeWriter();
            BitMatrix bitMatrix = qrCodeWriter.encode(totpUri, BarcodeFormat.QR_CODE, qrWidth, qrHeight);

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(bitMatrix, "PNG", outputStream);

            String base64Image = Base64.getEncoder().encodeToString(outputStream.toByteArray());
            log.debug("Generated QR code image of size: {} bytes", outputStream.size());
            return "data:image/png;base64," + base64Image;
        } catch (Exception e) {
            log.error("Failed to generate QR code: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to generate QR code", e);
        }
    }

    /**
     * Checks a submitted code against the current time step, allowing one step either side.
     */
    public boolean verifyCode(String secret, String providedCode) {
        if (secret == null || secret.isBlank() || providedCode == null || providedCode.isBlank()) {
            log.debug("TOTP verification failed - null or empty secret/code");
            return false;
        }

        String cleanCode = providedCode.trim();
        if (!cleanCode.matches(CODE_PATTERN)) {
            log.debug("TOTP verification failed - invalid code format");
            return false;
        }

        boolean valid = codeVerifier.isValidCode(secret, cleanCode);
        log.debug("TOTP code verification {}", valid ? "succeeded" : "failed");
        return valid;
    }

    /**
     * Code for the current time step. Used by diagnostics and tests.
     */
    public String currentCode(String secret) {
        try {
            long counter = Math.floorDiv(timeProvider.getTime(), periodSeconds);
            return codeGenerator.generate(secret, counter);
        } catch (CodeGenerationException e) {
            throw new IllegalStateException("Failed to generate TOTP code", e);
        }
    }
}
