package com.policysync.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Request body sent to the management server. Exactly one of the two parts is set.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceManagementRequest(
    PolicyFetchRequest policyRequest,
    RegisterRequest registerRequest
) {

    public static DeviceManagementRequest policy(PolicyFetchRequest request) {
        return new DeviceManagementRequest(request, null);
    }

    public static DeviceManagementRequest register(RegisterRequest request) {
        return new DeviceManagementRequest(null, request);
    }

    /**
     * @param timestamp        last known refresh time in epoch millis, only when managed
     * @param publicKeyVersion last key version seen, so the server can tell about rotation
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PolicyFetchRequest(
        String policyType,
        String signatureType,
        String machineId,
        Long timestamp,
        Integer publicKeyVersion
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RegisterRequest(
        String policyType,
        String machineId,
        String machineModel
    ) {}
}
