package com.portfolio.auth.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolio.auth.config.AppProperties;
import com.portfolio.auth.domain.AuthenticatedUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-through cache of {@link AuthenticatedUser} under {@code user:<id>}. Purely a
 * performance aid: outages and unreadable entries behave as misses. Every change to a
 * credential must {@link #evict(UUID)} so the request gate does not serve stale state.
 */
@Component
public class AuthenticatedUserCache {

    private static final Logger log = LoggerFactory.getLogger(AuthenticatedUserCache.class);

    static final String KEY_PREFIX = "user:";

    private final ResilientStateCache cache;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public AuthenticatedUserCache(ResilientStateCache cache, ObjectMapper objectMapper, AppProperties props) {
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofSeconds(props.getAuth().getUserCacheTtlSeconds());
    }

    public Optional<AuthenticatedUser> get(UUID userId) {
        Optional<String> json = cache.readOrEmpty(KEY_PREFIX + userId, "user cache read");
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), AuthenticatedUser.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cached user {}: {}", userId, e.getOriginalMessage());
            evict(userId);
            return Optional.empty();
        }
    }

    public void put(AuthenticatedUser user) {
        try {
            cache.writeQuietly(KEY_PREFIX + user.id(), objectMapper.writeValueAsString(user), ttl, "user cache write");
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize user {} for caching: {}", user.id(), e.getOriginalMessage());
        }
    }

    public void evict(UUID userId) {
        cache.deleteQuietly(KEY_PREFIX + userId, "user cache evict");
    }
}
