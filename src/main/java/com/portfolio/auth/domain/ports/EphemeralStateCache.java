package com.portfolio.auth.domain.ports;

import com.portfolio.auth.exception.CacheUnavailableException;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry TTL holding revocation markers, pending TOTP secrets,
 * second-factor flags and cached user projections.
 *
 * <p>Implementations are shared by every request thread and must be safe for concurrent
 * use. Every data operation throws {@link CacheUnavailableException} when the backing
 * store cannot be reached; callers may consult {@link #isConnected()} to skip the call.
 */
public interface EphemeralStateCache {

    void connect();

    void close();

    boolean isConnected();

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);
}
