package com.portfolio.auth.infrastructure.cache;

import com.portfolio.auth.domain.ports.EphemeralStateCache;
import com.portfolio.auth.exception.CacheUnavailableException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed cache. Tracks connectivity so callers can skip calls during an outage;
 * any Redis failure flips the flag and is rethrown as {@link CacheUnavailableException}.
 * A scheduled probe restores the flag once Redis answers again.
 */
@Component
@ConditionalOnProperty(name = "app.cache.type", havingValue = "redis", matchIfMissing = true)
public class RedisEphemeralStateCache implements EphemeralStateCache {

    private static final Logger log = LoggerFactory.getLogger(RedisEphemeralStateCache.class);

    private final StringRedisTemplate redis;
    private volatile boolean connected;
    private volatile boolean closed;

    public RedisEphemeralStateCache(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    @PostConstruct
    public void connect() {
        closed = false;
        try {
            String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
            connected = true;
            log.info("Redis cache connected ({})", pong);
        } catch (DataAccessException e) {
            connected = false;
            log.warn("Redis cache unavailable at startup, continuing without cache: {}", e.getMessage());
        }
    }

    @Override
    @PreDestroy
    public void close() {
        closed = true;
        connected = false;
        log.info("Redis cache closed");
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Scheduled(fixedDelayString = "${app.cache.reconnect-interval-ms:30000}")
    public void reconnectIfNeeded() {
        if (connected || closed) {
            return;
        }
        log.debug("Probing Redis connection");
        connect();
    }

    @Override
    public Optional<String> get(String key) {
        ensureConnected("get");
        try {
            return Optional.ofNullable(redis.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw unavailable("get", e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        ensureConnected("set");
        try {
            redis.opsForValue().set(key, value, ttl);
        } catch (DataAccessException e) {
            throw unavailable("set", e);
        }
    }

    @Override
    public void delete(String key) {
        ensureConnected("delete");
        try {
            redis.delete(key);
        } catch (DataAccessException e) {
            throw unavailable("delete", e);
        }
    }

    private void ensureConnected(String operation) {
        if (!connected) {
            throw new CacheUnavailableException("Redis is not connected (" + operation + ")");
        }
    }

    private CacheUnavailableException unavailable(String operation, DataAccessException e) {
        connected = false;
        log.error("Redis {} failed, marking cache disconnected: {}", operation, e.getMessage());
        return new CacheUnavailableException("Redis " + operation + " failed", e);
    }
}
