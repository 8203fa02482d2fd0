package com.nayem.warden.maintenance;

import java.util.Optional;

/**
 * Always grants the token. For single-instance deployments.
 */
public class NoOpCoordinationLock implements CoordinationLock {

    @Override
    public Optional<CoordinationLease> tryAcquire(String token) {
        return Optional.of(new CoordinationLease() {
            @Override
            public String token() {
                return token;
            }

            @Override
            public void close() {
                // nothing held
            }
        });
    }
}
