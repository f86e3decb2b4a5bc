package com.policysync.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.policysync.contract.PolicyFetchResponse;

/**
 * What a {@link PolicyCacheStore} persists: either the last accepted fetch
 * response or an "unmanaged" marker, plus the time of that refresh in epoch millis.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CachedPolicy(
    PolicyFetchResponse response,
    long timestamp,
    boolean unmanaged
) {

    public static CachedPolicy managed(PolicyFetchResponse response, long timestamp) {
        return new CachedPolicy(response, timestamp, false);
    }

    public static CachedPolicy unmanaged(long timestamp) {
        return new CachedPolicy(null, timestamp, true);
    }
}
