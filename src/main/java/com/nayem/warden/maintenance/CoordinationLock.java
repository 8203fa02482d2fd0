package com.nayem.warden.maintenance;

import java.util.Optional;

/**
 * Cross-instance coordination for the maintenance cycle.
 * <p>
 * At most one cooperating instance holds a given token at a time. This is
 * best-effort: callers treat an infrastructure failure as "proceed anyway".
 * </p>
 */
public interface CoordinationLock {

    /**
     * Attempts to take {@code token} without waiting.
     *
     * @param token the well-known coordination token
     * @return a lease if acquired, or empty if another instance holds it
     * @throws RuntimeException if the backing store could not be asked
     */
    Optional<CoordinationLease> tryAcquire(String token);
}
