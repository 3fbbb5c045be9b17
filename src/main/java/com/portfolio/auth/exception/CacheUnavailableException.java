package com.portfolio.auth.exception;

/**
 * The ephemeral state cache could not be reached. Callers decide whether to degrade
 * (treat as a miss, skip the write) or to fail.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
