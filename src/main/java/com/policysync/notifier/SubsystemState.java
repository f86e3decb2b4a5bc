package com.policysync.notifier;

/**
 * Coarse status of a policy subsystem as seen by enrollment and status surfaces.
 */
public enum SubsystemState {
    UNENROLLED,
    BAD_GAIA_TOKEN,
    UNMANAGED,
    NETWORK_ERROR,
    LOCAL_ERROR,
    TOKEN_FETCHED,
    SUCCESS
}
