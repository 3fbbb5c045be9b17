package com.portfolio.auth.exception;

/**
 * Raised when a login targets a credential whose lock has not yet expired. The message
 * never reveals how long the lock has left.
 */
public class AccountLockedException extends UnauthenticatedException {

    public static final String MESSAGE =
            "Account is temporarily locked due to too many failed login attempts. Please try again later.";

    public AccountLockedException() {
        super(MESSAGE);
    }
}
