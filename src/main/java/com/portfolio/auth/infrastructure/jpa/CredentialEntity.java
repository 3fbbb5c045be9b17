package com.portfolio.auth.infrastructure.jpa;

import com.portfolio.auth.domain.Role;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "credentials")
public class CredentialEntity {

    @Id
    private UUID id;

    @Column(nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "first_name", nullable = false, length = 50)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 50)
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Role role = Role.USER;

    @Column(nullable = false)
    private Boolean active = true;

    @Column(nullable = false)
    private Boolean verified = false;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "last_login")
    private Instant lastLogin;

    // ===============================================================================
    // LOCKOUT FIELDS
    // ===============================================================================

    @Column(name = "failed_login_attempts", nullable = false)
    private Integer failedLoginAttempts = 0;

    @Column(name = "lock_until")
    private Instant lockUntil;

    // ===============================================================================
    // TWO-FACTOR FIELDS (secret is stored encrypted)
    // ===============================================================================

    @Column(name = "two_factor_secret_enc", length = 512)
    private String twoFactorSecretEncrypted;

    @Column(name = "two_factor_enabled", nullable = false)
    private Boolean twoFactorEnabled = false;

    // ===============================================================================
    // ONE-TIME TOKEN FIELDS
    // ===============================================================================

    @Column(name = "verification_token_hash", length = 64)
    private String verificationTokenHash;

    @Column(name = "verification_token_expires")
    private Instant verificationTokenExpires;

    @Column(name = "reset_token_hash", length = 64)
    private String resetTokenHash;

    @Column(name = "reset_token_expires")
    private Instant resetTokenExpires;

    // ===============================================================================
    // GETTERS AND SETTERS
    // ===============================================================================

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email == null ? null : email.toLowerCase(); }

    public String getPasswordHash() { return passwordHash; }
    public void setPasswordHash(String passwordHash) { this.passwordHash = passwordHash; }

    public String getFirstName() { return firstName; }
    public void setFirstName(String firstName) { this.firstName = firstName; }

    public String getLastName() { return lastName; }
    public void setLastName(String lastName) { this.lastName = lastName; }

    public Role getRole() { return role; }
    public void setRole(Role role) { this.role = role; }

    public boolean isActive() { return Boolean.TRUE.equals(active); }
    public void setActive(Boolean active) { this.active = active != null ? active : Boolean.TRUE; }

    public boolean isVerified() { return Boolean.TRUE.equals(verified); }
    public void setVerified(Boolean verified) { this.verified = verified != null ? verified : Boolean.FALSE; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getLastLogin() { return lastLogin; }
    public void setLastLogin(Instant lastLogin) { this.lastLogin = lastLogin; }

    public int getFailedLoginAttempts() { return failedLoginAttempts == null ? 0 : failedLoginAttempts; }
    public void setFailedLoginAttempts(Integer failedLoginAttempts) {
        this.failedLoginAttempts = failedLoginAttempts != null ? Math.max(0, failedLoginAttempts) : 0;
    }

    public Instant getLockUntil() { return lockUntil; }
    public void setLockUntil(Instant lockUntil) { this.lockUntil = lockUntil; }

    public String getTwoFactorSecretEncrypted() { return twoFactorSecretEncrypted; }
    public void setTwoFactorSecretEncrypted(String twoFactorSecretEncrypted) { this.twoFactorSecretEncrypted = twoFactorSecretEncrypted; }

    public boolean isTwoFactorEnabled() { return Boolean.TRUE.equals(twoFactorEnabled); }
    public void setTwoFactorEnabled(Boolean twoFactorEnabled) {
        this.twoFactorEnabled = twoFactorEnabled != null ? twoFactorEnabled : Boolean.FALSE;
    }

    public String getVerificationTokenHash() { return verificationTokenHash; }
    public void setVerificationTokenHash(String verificationTokenHash) { this.verificationTokenHash = verificationTokenHash; }

    public Instant getVerificationTokenExpires() { return verificationTokenExpires; }
    public void setVerificationTokenExpires(Instant verificationTokenExpires) { this.verificationTokenExpires = verificationTokenExpires; }

    public String getResetTokenHash() { return resetTokenHash; }
    public void setResetTokenHash(String resetTokenHash) { this.resetTokenHash = resetTokenHash; }

    public Instant getResetTokenExpires() { return resetTokenExpires; }
    public void setResetTokenExpires(Instant resetTokenExpires) { this.resetTokenExpires = resetTokenExpires; }

    @Override
    public String toString() {
        return "CredentialEntity{" +
                "id=" + id +
                ", email='" + email + '\'' +
                ", role=" + role +
                ", active=" + active +
                ", verified=" + verified +
                ", twoFactorEnabled=" + twoFactorEnabled +
                '}';
    }
}
