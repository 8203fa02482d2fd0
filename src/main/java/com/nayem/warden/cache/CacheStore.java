package com.nayem.warden.cache;

import java.util.Optional;

/**
 * Synchronous key-value store for ephemeral computed state.
 * <p>
 * Implementations:
 * <ul>
 * <li>{@link ThreadSafeCache} - in-memory, safe for parallel threads</li>
 * <li>{@link RemoteCache} - Redis-backed, shared between processes</li>
 * </ul>
 * The cooperative variant is {@link AsyncCacheStore}.
 * </p>
 */
public interface CacheStore {

    /**
     * Looks up a live entry.
     *
     * @param key the cache key
     * @return the value, or empty on a miss (absent or expired)
     */
    Optional<CacheValue> get(String key);

    /**
     * Stores {@code value} under {@code key}, replacing any previous value and
     * resetting its insertion time.
     */
    void set(String key, CacheValue value);

    /**
     * Merges {@code value} into the existing entry (see
     * {@link CacheValue#mergeWith(CacheValue)}) or stores it if absent.
     */
    void upsert(String key, CacheValue value);

    /**
     * Removes the entry for {@code key}, if any.
     */
    void delete(String key);

    /**
     * Removes every entry owned by this store.
     */
    void clear();

    /**
     * Whether a live entry exists for {@code key}.
     */
    boolean contains(String key);

    default void set(String key, Object value) {
        set(key, CacheValue.of(value));
    }

    default void upsert(String key, Object value) {
        upsert(key, CacheValue.of(value));
    }
}
