package com.nayem.warden.cache;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory {@link CacheStore} safe for use from parallel threads.
 * <p>
 * One reentrant lock covers the whole store, so the same thread may nest
 * operations (e.g. {@link #upsert} reads then writes) without deadlocking.
 * Do not hold the lock across unrelated long-running work: every key shares it.
 * </p>
 * <p>
 * The {@code Lock}-taking overloads use a caller-owned lock instead of the
 * internal one, letting a cache operation join a larger critical section. The
 * supplied lock must be reentrant for {@link #upsert(String, CacheValue, Lock)}.
 * </p>
 */
public class ThreadSafeCache implements CacheStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final CacheEntries entries;

    public ThreadSafeCache(CacheConfiguration configuration) {
        this(configuration, Clock.systemUTC(), CacheMetrics.noOp());
    }

    public ThreadSafeCache(CacheConfiguration configuration, Clock clock, CacheMetrics metrics) {
        this.entries = new CacheEntries(configuration, clock, metrics);
    }

    @Override
    public Optional<CacheValue> get(String key) {
        return get(key, lock);
    }

    public Optional<CacheValue> get(String key, Lock lock) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, CacheValue value) {
        set(key, value, lock);
    }

    public void set(String key, CacheValue value, Lock lock) {
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void upsert(String key, CacheValue value) {
        upsert(key, value, lock);
    }

    public void upsert(String key, CacheValue value, Lock lock) {
        lock.lock();
        try {
            CacheValue merged = get(key, lock)
                    .map(existing -> existing.mergeWith(value))
                    .orElse(value);
            set(key, merged, lock);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        delete(key, lock);
    }

    public void delete(String key, Lock lock) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(String key) {
        lock.lock();
        try {
            return entries.contains(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
