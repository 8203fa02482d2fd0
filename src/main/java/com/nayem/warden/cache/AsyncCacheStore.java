package com.nayem.warden.cache;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counterpart of {@link CacheStore}. Every operation completes on
 * the store's scheduler.
 */
public interface AsyncCacheStore {

    CompletableFuture<Optional<CacheValue>> get(String key);

    CompletableFuture<Void> set(String key, CacheValue value);

    CompletableFuture<Void> upsert(String key, CacheValue value);

    CompletableFuture<Void> delete(String key);

    CompletableFuture<Void> clear();

    CompletableFuture<Boolean> contains(String key);

    default CompletableFuture<Void> set(String key, Object value) {
        return set(key, CacheValue.of(value));
    }

    default CompletableFuture<Void> upsert(String key, Object value) {
        return upsert(key, CacheValue.of(value));
    }
}
