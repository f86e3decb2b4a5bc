package com.policysync.controller;

public enum ControllerState {
    /** No device token yet; one is fetched as soon as credentials allow. */
    TOKEN_UNAVAILABLE,
    /** The user or device is known not to be managed. Waits for a credential change. */
    TOKEN_UNMANAGED,
    /** Token fetch failed or the server rejected the token. Retried with backoff. */
    TOKEN_ERROR,
    /** A device token is present; policy is fetched immediately. */
    TOKEN_VALID,
    /** Policy was fetched and applied. Refreshed periodically. */
    POLICY_VALID,
    /** Transient fetch failure. Retried with backoff. */
    POLICY_ERROR,
    /** The server could not or would not serve policy. Retried at the refresh rate. */
    POLICY_UNAVAILABLE
}
