package com.policysync.contract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Decoded payload of {@link PolicyFetchResponse#policyData()}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyData(
    Long timestamp,
    String policyType,
    Integer publicKeyVersion,
    Boolean machineIdMissing,
    Map<String, PolicyValue> policyValue
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PolicyValue(Object value, PolicyLevel mode) {}
}
