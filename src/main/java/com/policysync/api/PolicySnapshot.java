package com.policysync.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.policysync.contract.PolicyLevel;
import com.policysync.contract.PolicyMap;

/**
 * Combined policy of one level as served over REST.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PolicySnapshot(
    PolicyLevel level,
    boolean initializationComplete,
    int pendingCaches,
    PolicyMap policies
) {}
