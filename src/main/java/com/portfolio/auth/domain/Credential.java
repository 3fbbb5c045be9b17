package com.portfolio.auth.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's authentication record: password hash, lockout counters, second-factor state
 * and the one-time verification/reset tokens.
 *
 * <p>When loaded without secret fields, {@code passwordHash} and {@code twoFactorSecret}
 * are null and {@link #isSecretFieldsLoaded()} is false; saving such a credential keeps
 * the stored secrets untouched.
 */
public class Credential {

    private UUID id;
    private String email;
    private String passwordHash;
    private String firstName;
    private String lastName;
    private Role role = Role.USER;
    private boolean active = true;
    private boolean verified;

    // ===============================================================================
    // LOCKOUT STATE
    // ===============================================================================

    private int failedLoginAttempts;
    private Instant lockUntil;

    // ===============================================================================
    // SECOND FACTOR
    // ===============================================================================

    private String twoFactorSecret;
    private boolean twoFactorEnabled;

    // ===============================================================================
    // ONE-TIME TOKENS (stored as SHA-256 hashes)
    // ===============================================================================

    private String verificationTokenHash;
    private Instant verificationTokenExpires;
    private String resetTokenHash;
    private Instant resetTokenExpires;

    private Instant lastLogin;
    private Instant createdAt;
    private boolean secretFieldsLoaded = true;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email == null ? null : email.trim().toLowerCase(); }

    public String getPasswordHash() { return passwordHash; }
    public void setPasswordHash(String passwordHash) { this.passwordHash = passwordHash; }

    public String getFirstName() { return firstName; }
    public void setFirstName(String firstName) { this.firstName = firstName; }

    public String getLastName() { return lastName; }
    public void setLastName(String lastName) { this.lastName = lastName; }

    public Role getRole() { return role; }
    public void setRole(Role role) { this.role = role; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public boolean isVerified() { return verified; }
    public void setVerified(boolean verified) { this.verified = verified; }

    public int getFailedLoginAttempts() { return failedLoginAttempts; }
    public void setFailedLoginAttempts(int failedLoginAttempts) { this.failedLoginAttempts = failedLoginAttempts; }

    public Instant getLockUntil() { return lockUntil; }
    public void setLockUntil(Instant lockUntil) { this.lockUntil = lockUntil; }

    public String getTwoFactorSecret() { return twoFactorSecret; }
    public void setTwoFactorSecret(String twoFactorSecret) { this.twoFactorSecret = twoFactorSecret; }

    public boolean isTwoFactorEnabled() { return twoFactorEnabled; }
    public void setTwoFactorEnabled(boolean twoFactorEnabled) { this.twoFactorEnabled = twoFactorEnabled; }

    public String getVerificationTokenHash() { return verificationTokenHash; }
    public void setVerificationTokenHash(String verificationTokenHash) { this.verificationTokenHash = verificationTokenHash; }

    public Instant getVerificationTokenExpires() { return verificationTokenExpires; }
    public void setVerificationTokenExpires(Instant verificationTokenExpires) { this.verificationTokenExpires = verificationTokenExpires; }

    public String getResetTokenHash() { return resetTokenHash; }
    public void setResetTokenHash(String resetTokenHash) { this.resetTokenHash = resetTokenHash; }

    public Instant getResetTokenExpires() { return resetTokenExpires; }
    public void setResetTokenExpires(Instant resetTokenExpires) { this.resetTokenExpires = resetTokenExpires; }

    public Instant getLastLogin() { return lastLogin; }
    public void setLastLogin(Instant lastLogin) { this.lastLogin = lastLogin; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public boolean isSecretFieldsLoaded() { return secretFieldsLoaded; }
    public void setSecretFieldsLoaded(boolean secretFieldsLoaded) { this.secretFieldsLoaded = secretFieldsLoaded; }

    public String getFullName() {
        if (firstName == null && lastName == null) {
            return email;
        }
        return ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
    }
}
