package com.portfolio.auth.exception;

/**
 * Exception thrown when TOTP setup is requested for a user who already has two-factor
 * authentication enabled.
 */
public class MfaAlreadyConfiguredException extends BadRequestException {

    /**
     * Constructs a new exception with the default detail message.
     */
    public MfaAlreadyConfiguredException() {
        this("Two-factor authentication is already enabled. Disable it before setting it up again.");
    }

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public MfaAlreadyConfiguredException(String message) {
        super(message);
    }
}
