package com.portfolio.auth.application;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/** Short, non-reversible label for a bearer token, safe to write to logs. */
public final class TokenFingerprint {

    private TokenFingerprint() {
    }

    public static String of(String token) {
        if (token == null || token.isEmpty()) {
            return "<none>";
        }
        return DigestUtils.md5DigestAsHex(token.getBytes(StandardCharsets.UTF_8)).substring(0, 12);
    }
}
