package com.nayem.warden.lock;

/**
 * Thrown synchronously when a worker-lock key contains characters outside
 * {@code [A-Za-z0-9_]}. No file is touched before this is raised.
 */
public class InvalidLockKeyException extends IllegalArgumentException {

    private final String key;

    public InvalidLockKeyException(String key) {
        super("Invalid lock key '" + key + "': only letters, digits and underscores are allowed");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
