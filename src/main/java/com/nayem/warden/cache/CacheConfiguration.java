package com.nayem.warden.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Bounds applied to a cache store.
 *
 * @param maxSize    upper bound on entries before least-recently-used eviction,
 *                   or {@code null} for unbounded
 * @param expiration time-to-live measured from insertion, or {@code null} for
 *                   entries that never expire
 */
public record CacheConfiguration(Integer maxSize, Duration expiration) {

    public CacheConfiguration {
        if (maxSize != null && maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, got " + maxSize);
        }
        if (expiration != null && (expiration.isZero() || expiration.isNegative())) {
            throw new IllegalArgumentException("expiration must be positive, got " + expiration);
        }
    }

    public static CacheConfiguration unbounded() {
        return new CacheConfiguration(null, null);
    }

    public static CacheConfiguration of(int maxSize, Duration expiration) {
        return new CacheConfiguration(maxSize, expiration);
    }

    public Optional<Integer> maxSizeLimit() {
        return Optional.ofNullable(maxSize);
    }

    public Optional<Duration> timeToLive() {
        return Optional.ofNullable(expiration);
    }
}
