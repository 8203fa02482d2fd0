package com.nayem.warden.cache;

/**
 * The value could not be converted to or from the store's wire format.
 * When raised from a write, nothing has been written.
 */
public class CacheSerializationException extends CacheException {

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
