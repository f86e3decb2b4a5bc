package com.policysync.transport;

/**
 * Entry point to the management server transport.
 */
public interface DeviceManagementService {

    FetchJob createJob(JobType type);
}
