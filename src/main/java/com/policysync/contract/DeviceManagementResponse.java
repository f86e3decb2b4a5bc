package com.policysync.contract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceManagementResponse(
    PolicyResponse policyResponse,
    RegisterResponse registerResponse
) {

    public static DeviceManagementResponse empty() {
        return new DeviceManagementResponse(null, null);
    }

    public static DeviceManagementResponse ofPolicies(PolicyFetchResponse... responses) {
        return new DeviceManagementResponse(new PolicyResponse(List.of(responses)), null);
    }

    public static DeviceManagementResponse ofToken(String deviceManagementToken) {
        return new DeviceManagementResponse(null, new RegisterResponse(deviceManagementToken));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PolicyResponse(List<PolicyFetchResponse> responses) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RegisterResponse(String deviceManagementToken) {}
}
