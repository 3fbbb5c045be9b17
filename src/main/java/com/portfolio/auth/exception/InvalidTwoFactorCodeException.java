package com.portfolio.auth.exception;

public class InvalidTwoFactorCodeException extends BadRequestException {

    public InvalidTwoFactorCodeException(String message) {
        super(message);
    }
}
