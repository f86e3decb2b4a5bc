package com.policysync.cache;

/**
 * Raised by a {@link PolicyCacheStore} when its backing storage cannot be read or written.
 */
public class PolicyStoreException extends RuntimeException {

    public PolicyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
