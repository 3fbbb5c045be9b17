package com.portfolio.auth.application;

import com.portfolio.auth.config.AppProperties;
import com.portfolio.auth.config.JwtService;
import com.portfolio.auth.domain.ports.EphemeralStateCache;
import com.portfolio.auth.exception.CacheUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Revocation ledger. A revoked token is stored as {@code token_blacklist:<token>} for the
 * rest of its natural lifetime; markers are never deleted, they simply expire.
 *
 * <p>What an unreachable cache means for {@link #isRevoked(String)} is decided by
 * {@code app.auth.revocation.fail-open}: true answers "not revoked", false answers
 * "revoked" and so rejects every authenticated request until the cache is back.
 */
@Service
public class TokenRevocationService {

    private static final Logger log = LoggerFactory.getLogger(TokenRevocationService.class);

    static final String KEY_PREFIX = "token_blacklist:";

    private final EphemeralStateCache cache;
    private final JwtService jwtService;
    private final Clock clock;
    private final boolean failOpen;
    private final Duration fallbackTtl;

    public TokenRevocationService(EphemeralStateCache cache, JwtService jwtService, Clock clock, AppProperties props) {
        this.cache = cache;
        this.jwtService = jwtService;
        this.clock = clock;
        this.failOpen = props.getAuth().getRevocation().isFailOpen();
        this.fallbackTtl = Duration.ofSeconds(props.getAuth().getRevocation().getFallbackTtlSeconds());
        log.info("Token revocation ledger initialized - failOpen: {}, fallback TTL: {}s",
                failOpen, fallbackTtl.toSeconds());
    }

    /**
     * Records the token as revoked. A cache failure is logged as a security event and
     * swallowed so the calling request still completes.
     */
    public void revoke(String token) {
        Duration ttl = markerTtl(token);
        String fingerprint = TokenFingerprint.of(token);
        try {
            cache.set(KEY_PREFIX + token, "true", ttl);
            log.info("Token {} revoked for {}s", fingerprint, ttl.toSeconds());
        } catch (CacheUnavailableException e) {
            log.error("SECURITY: revocation of token {} was NOT recorded, token stays usable until it expires: {}",
                    fingerprint, e.getMessage());
        }
    }

    public boolean isRevoked(String token) {
        if (!cache.isConnected()) {
            return unavailableVerdict(token, "cache disconnected");
        }
        try {
            return cache.get(KEY_PREFIX + token).isPresent();
        } catch (CacheUnavailableException e) {
            return unavailableVerdict(token, e.getMessage());
        }
    }

    /** Remaining lifetime from the unverified {@code exp} claim, or the fallback TTL. */
    Duration markerTtl(String token) {
        Optional<Instant> expiry = jwtService.readExpiryUnverified(token);
        if (expiry.isEmpty()) {
            return fallbackTtl;
        }
        long seconds = Duration.between(clock.instant(), expiry.get()).toSeconds();
        return seconds > 0 ? Duration.ofSeconds(seconds) : fallbackTtl;
    }

    private boolean unavailableVerdict(String token, String reason) {
        if (failOpen) {
            log.warn("SECURITY: revocation check skipped for token {} (fail-open): {}",
                    TokenFingerprint.of(token), reason);
            return false;
        }
        log.error("SECURITY: revocation check unavailable for token {}, rejecting (fail-closed): {}",
                TokenFingerprint.of(token), reason);
        return true;
    }
}
