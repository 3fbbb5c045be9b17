package com.portfolio.auth.infrastructure.notify;

import com.portfolio.auth.domain.ports.AccountNotifierPort;
import org.slf4j.Logger; import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Stands in for the mail provider: each message is logged on the async executor instead
 * of being sent. Links are logged without their token query string.
 */
@Component
public class LoggingAccountNotifier implements AccountNotifierPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingAccountNotifier.class);

  @Async
  @Override public void sendVerificationEmail(String email, String displayName, String verificationUrl) {
    log.info("Verification email queued for {} ({}) -> {}", email, displayName, stripToken(verificationUrl));
  }

  @Async
  @Override public void sendPasswordResetEmail(String email, String displayName, String resetUrl) {
    log.info("Password reset email queued for {} ({}) -> {}", email, displayName, stripToken(resetUrl));
  }

  @Async
  @Override public void sendPasswordChangedEmail(String email, String displayName) {
    log.info("Password changed notice queued for {} ({})", email, displayName);
  }

  static String stripToken(String url) {
    if (url == null) return null;
    int q = url.indexOf('?');
    return q < 0 ? url : url.substring(0, q) + "?token=***";
  }
}
