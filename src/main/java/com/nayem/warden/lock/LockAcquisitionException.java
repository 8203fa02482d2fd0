package com.nayem.warden.lock;

/**
 * Thrown when a keyed lock could not be obtained, either because the waiting
 * thread was interrupted or because the backing lock file could not be opened
 * or locked.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
