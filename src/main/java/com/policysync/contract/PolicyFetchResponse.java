package com.policysync.contract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One signed policy blob as returned by the management server.
 * {@code policyData} is the serialized {@link PolicyData} document.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyFetchResponse(
    String policyData,
    String policyDataSignature,
    Integer errorCode,
    String errorMessage
) {

    /** Error code the server uses for a successful per-policy fetch. */
    public static final int POLICY_FETCH_SUCCESS = 200;

    public static PolicyFetchResponse of(String policyData) {
        return new PolicyFetchResponse(policyData, null, null, null);
    }

    public boolean hasError() {
        return errorCode != null && errorCode != POLICY_FETCH_SUCCESS;
    }
}
