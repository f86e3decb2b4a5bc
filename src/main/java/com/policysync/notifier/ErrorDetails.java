package com.policysync.notifier;

public enum ErrorDetails {
    NO_DETAILS,
    DMTOKEN_NETWORK_ERROR,
    POLICY_NETWORK_ERROR,
    BAD_DMTOKEN,
    POLICY_LOCAL_ERROR,
    SIGNATURE_MISMATCH,
    BAD_SERIAL_NUMBER,
    AUTO_RETRY,
    MISSING_LICENSES
}
