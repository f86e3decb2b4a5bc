package com.policysync.transport;

import com.policysync.contract.DeviceManagementRequest;
import com.policysync.contract.DeviceManagementResponse;
import com.policysync.contract.UserAffiliation;

/**
 * One request to the management server. Configure, then {@link #start} once.
 */
public interface FetchJob {

    @FunctionalInterface
    interface Callback {
        void onJobCompleted(DeviceManagementStatus status, DeviceManagementResponse response);
    }

    JobType type();

    FetchJob setDmToken(String dmToken);

    FetchJob setAuthToken(String authToken);

    FetchJob setClientId(String clientId);

    FetchJob setUserAffiliation(UserAffiliation affiliation);

    FetchJob setRequest(DeviceManagementRequest request);

    DeviceManagementRequest request();

    /**
     * Sends the request. The callback runs on the policy sequence and is
     * dropped if {@link #cancel()} was called first.
     */
    void start(Callback callback);

    void cancel();
}
