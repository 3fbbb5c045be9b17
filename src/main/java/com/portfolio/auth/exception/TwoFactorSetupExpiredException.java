package com.portfolio.auth.exception;

public class TwoFactorSetupExpiredException extends BadRequestException {

    public TwoFactorSetupExpiredException() {
        super("TOTP setup has expired. Please try again.");
    }
}
