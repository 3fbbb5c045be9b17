package com.portfolio.auth.domain.ports;

/**
 * Outbound account mail. Implementations dispatch asynchronously; callers never wait on
 * delivery.
 */
public interface AccountNotifierPort {

    void sendVerificationEmail(String email, String displayName, String verificationUrl);

    void sendPasswordResetEmail(String email, String displayName, String resetUrl);

    void sendPasswordChangedEmail(String email, String displayName);
}
