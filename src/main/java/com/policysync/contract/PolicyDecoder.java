package com.policysync.contract;

/**
 * Turns a fetch response into a policy map plus freshness metadata.
 * Implementations must be pure: no I/O, no side effects.
 */
public interface PolicyDecoder {

    /**
     * @throws PolicyDecodeException if the response is malformed or missing required fields
     */
    DecodedPolicy decode(PolicyFetchResponse response);
}
