package com.policysync.contract;

/**
 * Thrown when a fetch response cannot be turned into a policy map.
 */
public class PolicyDecodeException extends RuntimeException {

    public PolicyDecodeException(String message) {
        super(message);
    }

    public PolicyDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
