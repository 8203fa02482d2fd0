package com.nayem.warden.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Access-ordered entry table with lazy TTL expiry and LRU eviction.
 * <p>
 * Not thread-safe: every call must be made under the owning store's lock.
 * Iteration order is recency of use, most recently used last.
 * </p>
 */
final class CacheEntries {

    private final Map<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final CacheConfiguration configuration;
    private final Clock clock;
    private final CacheMetrics metrics;

    CacheEntries(CacheConfiguration configuration, Clock clock, CacheMetrics metrics) {
        this.configuration = configuration;
        this.clock = clock;
        this.metrics = metrics;
    }

    Optional<CacheValue> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            metrics.recordMiss();
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(key);
            metrics.recordExpiration();
            metrics.recordMiss();
            return Optional.empty();
        }
        metrics.recordHit();
        return Optional.of(entry.value());
    }

    void put(String key, CacheValue value) {
        if (value == null) {
            throw new IllegalArgumentException("Cache value must not be null");
        }
        Integer maxSize = configuration.maxSize();
        if (maxSize != null && !entries.containsKey(key)) {
            while (entries.size() >= maxSize) {
                evictEldest();
            }
        }
        // remove first so a replaced key moves to the most-recent position
        entries.remove(key);
        entries.put(key, new Entry(value, clock.instant()));
    }

    void upsert(String key, CacheValue value) {
        CacheValue merged = get(key)
                .map(existing -> existing.mergeWith(value))
                .orElse(value);
        put(key, merged);
    }

    boolean contains(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        if (isExpired(entry)) {
            entries.remove(key);
            metrics.recordExpiration();
            return false;
        }
        return true;
    }

    void remove(String key) {
        entries.remove(key);
    }

    void clear() {
        entries.clear();
    }

    int size() {
        return entries.size();
    }

    private void evictEldest() {
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            it.next();
            it.remove();
            metrics.recordEviction();
        }
    }

    private boolean isExpired(Entry entry) {
        Duration expiration = configuration.expiration();
        if (expiration == null) {
            return false;
        }
        return Duration.between(entry.insertedAt(), clock.instant()).compareTo(expiration) >= 0;
    }

    private record Entry(CacheValue value, Instant insertedAt) {
    }
}
