package com.policysync.contract;

import java.time.Instant;

/**
 * Result of decoding one {@link PolicyFetchResponse}.
 *
 * @param policies         decoded policy values
 * @param timestamp        server-side issue time of the policy blob
 * @param publicKeyVersion key generation the blob was signed with, if reported
 * @param machineIdMissing whether the server asked for the machine id to be sent
 */
public record DecodedPolicy(
    PolicyMap policies,
    Instant timestamp,
    PublicKeyVersion publicKeyVersion,
    boolean machineIdMissing
) {}
