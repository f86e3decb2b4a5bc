package com.policysync.controller;

/**
 * Obtains the device management token through the registration exchange and
 * records server verdicts that make registration pointless.
 */
public interface TokenFetcher {

    void fetchToken();

    /** The server says this user or device is not managed. */
    void setUnmanagedState();

    /** The server no longer recognises the device serial number. */
    void setSerialNumberInvalidState();

    /** The domain has no licenses left for this device. */
    void setMissingLicensesState();
}
