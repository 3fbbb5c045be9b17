package com.portfolio.auth.domain;

import java.time.Instant;

public record LockoutStatus(int failedLoginAttempts, Instant lockUntil, boolean locked) {
}
