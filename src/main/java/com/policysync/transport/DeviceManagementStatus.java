package com.policysync.transport;

/**
 * Outcome of one request to the management server, as seen by the policy
 * subsystem. Raw HTTP codes never travel past the transport.
 */
public enum DeviceManagementStatus {
    SUCCESS,
    REQUEST_INVALID,
    REQUEST_FAILED,
    TEMPORARY_UNAVAILABLE,
    HTTP_STATUS_ERROR,
    RESPONSE_DECODING_ERROR,
    SERVICE_MANAGEMENT_NOT_SUPPORTED,
    SERVICE_DEVICE_NOT_FOUND,
    SERVICE_MANAGEMENT_TOKEN_INVALID,
    SERVICE_ACTIVATION_PENDING,
    SERVICE_INVALID_SERIAL_NUMBER,
    SERVICE_DEVICE_ID_CONFLICT,
    SERVICE_MISSING_LICENSES,
    SERVICE_POLICY_NOT_FOUND;

    public static DeviceManagementStatus fromHttpStatus(int code) {
        return switch (code) {
            case 200 -> SUCCESS;
            case 400 -> REQUEST_INVALID;
            case 401 -> SERVICE_MANAGEMENT_TOKEN_INVALID;
            case 402 -> SERVICE_MISSING_LICENSES;
            case 403 -> SERVICE_MANAGEMENT_NOT_SUPPORTED;
            case 405 -> SERVICE_INVALID_SERIAL_NUMBER;
            case 409 -> SERVICE_DEVICE_ID_CONFLICT;
            case 410, 901 -> SERVICE_DEVICE_NOT_FOUND;
            case 491 -> SERVICE_ACTIVATION_PENDING;
            case 902 -> SERVICE_POLICY_NOT_FOUND;
            // 404 comes from misrouted frontends rather than the service itself
            case 404 -> TEMPORARY_UNAVAILABLE;
            default -> code >= 500 && code <= 599 ? TEMPORARY_UNAVAILABLE : HTTP_STATUS_ERROR;
        };
    }
}
