package com.policysync.connector;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.policysync.controller.ControllerState;
import com.policysync.notifier.ErrorDetails;
import com.policysync.notifier.SubsystemState;

/**
 * Point-in-time view of one policy subsystem for status surfaces.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubsystemStatus(
    String domain,
    ControllerState controllerState,
    SubsystemState state,
    ErrorDetails errorDetails,
    boolean cacheReady,
    boolean unmanaged,
    String lastRefreshTime,
    int policyCount
) {}
