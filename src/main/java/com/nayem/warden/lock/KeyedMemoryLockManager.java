package com.nayem.warden.lock;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-key mutual exclusion within one JVM.
 * <p>
 * Callers passing equal keys to the same manager run their critical sections
 * one at a time; callers with different keys never block each other.
 * </p>
 * <p>
 * One lock object is created per key on first use and kept for the lifetime
 * of the manager. Entries are never evicted, so the map grows with the number
 * of distinct keys ever seen.
 * </p>
 *
 * @param <K> the key type; must implement {@code equals}/{@code hashCode}
 */
public class KeyedMemoryLockManager<K> {

    private final ReentrantLock guard = new ReentrantLock();
    private final Map<K, ReentrantLock> locks = new HashMap<>();

    /**
     * Blocks until the lock for {@code key} is held by the calling thread.
     *
     * @param key the resource key
     * @return a handle that releases the lock when closed
     * @throws LockAcquisitionException if the thread is interrupted while waiting
     */
    public LockHandle lock(K key) {
        ReentrantLock lock = lockFor(key);
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while waiting for lock on " + key, e);
        }
        return new MemoryLockHandle(key, lock);
    }

    /**
     * Runs {@code action} while holding the lock for {@code key}. The lock is
     * released on every exit path and exceptions thrown by the action
     * propagate unchanged.
     */
    public <R> R withLock(K key, Callable<R> action) throws Exception {
        try (LockHandle ignored = lock(key)) {
            return action.call();
        }
    }

    /**
     * Number of keys that currently have a lock object.
     */
    public int size() {
        guard.lock();
        try {
            return locks.size();
        } finally {
            guard.unlock();
        }
    }

    ReentrantLock lockFor(K key) {
        if (key == null) {
            throw new IllegalArgumentException("Lock key must not be null");
        }
        guard.lock();
        try {
            ReentrantLock lock = locks.get(key);
            if (lock == null) {
                lock = new ReentrantLock();
                locks.put(key, lock);
            }
            return lock;
        } finally {
            guard.unlock();
        }
    }

    private static final class MemoryLockHandle implements LockHandle {
        private final Object key;
        private final ReentrantLock lock;
        private final AtomicBoolean released = new AtomicBoolean();

        MemoryLockHandle(Object key, ReentrantLock lock) {
            this.key = key;
            this.lock = lock;
        }

        @Override
        public Object key() {
            return key;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                lock.unlock();
            }
        }
    }
}
