package com.portfolio.auth.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for failures that are rendered to the caller. The message is always safe to
 * show; internal detail goes to the log instead.
 */
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;

    protected ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected ApiException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
