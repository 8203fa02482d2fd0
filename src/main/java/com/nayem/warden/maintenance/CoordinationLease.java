package com.nayem.warden.maintenance;

/**
 * A held coordination token. Closing the lease releases the token; it must be
 * closed on every exit path of the cycle that acquired it. Closing twice is a
 * no-op.
 */
public interface CoordinationLease extends AutoCloseable {

    String token();

    @Override
    void close();
}
