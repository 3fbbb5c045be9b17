package com.portfolio.auth.infrastructure.cache;

import com.portfolio.auth.domain.ports.EphemeralStateCache;
import com.portfolio.auth.exception.CacheUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-process cache for development and tests. Entries are lost on restart and not
 * shared between instances; do not use with more than one replica.
 *
 * <p>{@link #close()} makes every data operation fail with
 * {@link CacheUnavailableException}, which is how tests simulate an outage.
 */
@Component
@ConditionalOnProperty(name = "app.cache.type", havingValue = "memory")
public class InMemoryEphemeralStateCache implements EphemeralStateCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEphemeralStateCache.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile boolean connected = true;

    public InMemoryEphemeralStateCache(Clock clock) {
        this.clock = clock;
        log.info("Initialized in-memory ephemeral state cache");
    }

    @Override
    public void connect() {
        connected = true;
        log.info("In-memory cache connected");
    }

    @Override
    public void close() {
        connected = false;
        log.info("In-memory cache closed");
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public Optional<String> get(String key) {
        ensureConnected("get");
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        ensureConnected("set");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive for key " + key);
        }
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void delete(String key) {
        ensureConnected("delete");
        entries.remove(key);
    }

    @Scheduled(fixedDelay = 60000)
    public void cleanupExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Cleaned up {} expired cache entries", removed);
        }
    }

    public void clear() {
        entries.clear();
    }

    private void ensureConnected(String operation) {
        if (!connected) {
            throw new CacheUnavailableException("In-memory cache is closed (" + operation + ")");
        }
    }

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
