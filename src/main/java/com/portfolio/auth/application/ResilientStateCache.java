package com.portfolio.auth.application;

import com.portfolio.auth.domain.ports.EphemeralStateCache;
import com.portfolio.auth.exception.CacheUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Degrading access to the {@link EphemeralStateCache} for reads and writes whose loss only
 * costs performance or convenience. An unreachable cache reads as a miss, and writes or
 * deletes become logged no-ops.
 *
 * <p>Revocation checks do not go through here; see {@link TokenRevocationService}.
 */
@Component
public class ResilientStateCache {

    private static final Logger log = LoggerFactory.getLogger(ResilientStateCache.class);

    private final EphemeralStateCache cache;

    public ResilientStateCache(EphemeralStateCache cache) {
        this.cache = cache;
    }

    public Optional<String> readOrEmpty(String key, String operation) {
        if (!cache.isConnected()) {
            log.debug("Cache disconnected, treating {} as a miss", operation);
            return Optional.empty();
        }
        try {
            return cache.get(key);
        } catch (CacheUnavailableException e) {
            log.warn("Cache read failed (graceful): {}: {}", operation, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return whether the value was written
     */
    public boolean writeQuietly(String key, String value, Duration ttl, String operation) {
        if (!cache.isConnected()) {
            log.warn("Cache disconnected, skipped write: {}", operation);
            return false;
        }
        try {
            cache.set(key, value, ttl);
            return true;
        } catch (CacheUnavailableException e) {
            log.warn("Cache write failed (silent): {}: {}", operation, e.getMessage());
            return false;
        }
    }

    public boolean deleteQuietly(String key, String operation) {
        if (!cache.isConnected()) {
            log.warn("Cache disconnected, skipped delete: {}", operation);
            return false;
        }
        try {
            cache.delete(key);
            return true;
        } catch (CacheUnavailableException e) {
            log.warn("Cache delete failed (silent): {}: {}", operation, e.getMessage());
            return false;
        }
    }
}
