package com.portfolio.auth.exception;

/**
 * Bearer token failed verification: malformed, bad signature or expired. Never rendered
 * directly; the request gate turns it into a single generic 401.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
