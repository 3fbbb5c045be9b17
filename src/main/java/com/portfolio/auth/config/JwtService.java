package com.portfolio.auth.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.auth.domain.Role;
import com.portfolio.auth.domain.TokenClaims;
import com.portfolio.auth.exception.InvalidTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;

@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    private static final int MIN_SECRET_BYTES = 32;

    private final Key key;
    private final Duration defaultTtl;
    private final Duration rememberTtl;
    private final Duration refreshThreshold;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.ttl-seconds:604800}") long ttlSeconds,
            @Value("${security.jwt.remember-ttl-seconds:2592000}") long rememberTtlSeconds,
            @Value("${security.jwt.refresh-threshold-seconds:86400}") long refreshThresholdSeconds,
            Clock clock,
            ObjectMapper objectMapper) {
        byte[] secretBytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "security.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        this.key = Keys.hmacShaKeyFor(secretBytes);
        this.defaultTtl = Duration.ofSeconds(ttlSeconds);
        this.rememberTtl = Duration.ofSeconds(rememberTtlSeconds);
        this.refreshThreshold = Duration.ofSeconds(refreshThresholdSeconds);
        this.clock = clock;
        this.objectMapper = objectMapper;
        log.info("JWT service initialized - TTL: {}s, remember TTL: {}s, refresh threshold: {}s",
                ttlSeconds, rememberTtlSeconds, refreshThresholdSeconds);
    }

    /* ------------------------ token creation ------------------------ */

    public String issue(TokenClaims claims, Duration ttl) {
        Instant now = clock.instant();
        Date iat = Date.from(now);
        Date exp = Date.from(now.plus(ttl));

        log.debug("Issuing token for subject: {}, role: {}, ttl: {}s", claims.subject(), claims.role(), ttl.toSeconds());

        return Jwts.builder()
                .setSubject(claims.subject())
                .setIssuedAt(iat)
                .setExpiration(exp)
                .claim(CLAIM_EMAIL, claims.email())
                .claim(CLAIM_ROLE, claims.role().claimValue())
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public String issue(TokenClaims claims) {
        return issue(claims, defaultTtl);
    }

    /** 30-day token when the caller asked to be remembered, 7-day otherwise. */
    public Duration ttlFor(boolean remember) {
        return remember ? rememberTtl : defaultTtl;
    }

    /* ------------------------ token verification ------------------------ */

    /**
     * Checks signature and expiry against the service clock. Every failure mode is
     * reported as the same {@link InvalidTokenException}.
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty");
        }
        try {
            Claims body = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();

            String subject = body.getSubject();
            String email = body.get(CLAIM_EMAIL, String.class);
            String role = body.get(CLAIM_ROLE, String.class);
            if (subject == null || subject.isBlank() || role == null || body.getExpiration() == null) {
                throw new InvalidTokenException("Token is missing required claims");
            }

            return new TokenClaims(
                    subject,
                    email,
                    Role.fromClaim(role),
                    body.getIssuedAt() == null ? null : body.getIssuedAt().toInstant(),
                    body.getExpiration().toInstant());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token verification failed: {}", e.getMessage());
            throw new InvalidTokenException("Token verification failed", e);
        }
    }

    /* ------------------------ unverified reads ------------------------ */

    /**
     * Reads the {@code exp} claim WITHOUT checking the signature. Only for TTL arithmetic
     * (revocation marker lifetime, refresh decision); never use the result to authorize.
     */
    public Optional<Instant> readExpiryUnverified(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode exp = objectMapper.readTree(payload).get("exp");
            if (exp == null || !exp.canConvertToLong()) {
                return Optional.empty();
            }
            return Optional.of(Instant.ofEpochSecond(exp.asLong()));
        } catch (Exception e) {
            log.debug("Could not decode token payload: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Duration getRefreshThreshold() {
        return refreshThreshold;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }
}
