package com.nayem.warden.cache;

/**
 * The remote store could not be reached. Callers can tell this apart from a
 * cache miss, which is reported as an empty result.
 */
public class CacheConnectionException extends CacheException {

    public CacheConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
