package com.nayem.warden.cache;

/**
 * Base class for errors raised by cache stores. A miss is never an exception.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
