package com.nayem.warden.lock;

/**
 * A held keyed lock. Closing the handle releases the lock.
 * <p>
 * Intended for try-with-resources:
 * </p>
 *
 * <pre>
 * {@code
 * try (LockHandle ignored = locks.lock("flow_42")) {
 *     // exclusive section
 * }
 * }
 * </pre>
 */
public interface LockHandle extends AutoCloseable {

    /**
     * The key this handle was acquired for.
     */
    Object key();

    /**
     * Releases the lock. Calling it more than once has no further effect.
     */
    @Override
    void close();
}
