package com.policysync.controller;

import com.policysync.cache.PolicyCache;
import com.policysync.contract.DeviceManagementRequest;
import com.policysync.contract.DeviceManagementResponse;
import com.policysync.identity.IdentityStore;
import com.policysync.notifier.ErrorDetails;
import com.policysync.notifier.NotifierSource;
import com.policysync.notifier.PolicyNotifier;
import com.policysync.notifier.SubsystemState;
import com.policysync.scheduler.DelayedWorkScheduler;
import com.policysync.transport.DeviceManagementService;
import com.policysync.transport.DeviceManagementStatus;
import com.policysync.transport.FetchJob;
import com.policysync.transport.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Registers the client with the management server to obtain a device token.
 *
 * A fetched token is written to the {@link IdentityStore}, whose change
 * notification moves the controller on to fetching policy. Server verdicts that
 * make registration pointless (unmanaged, bad serial number, no licenses) stop
 * retries until the next explicit {@link #fetchToken()}. Other failures are
 * retried with a doubling delay.
 */
public class RegistrationTokenFetcher implements TokenFetcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RegistrationTokenFetcher.class);

    public enum State {
        INACTIVE,
        REQUESTING,
        TOKEN_AVAILABLE,
        UNMANAGED,
        BAD_SERIAL_NUMBER,
        MISSING_LICENSES,
        BAD_AUTH,
        TEMPORARY_ERROR,
        ERROR
    }

    private final DeviceManagementService service;
    private final PolicyCache cache;
    private final IdentityStore identityStore;
    private final PolicyNotifier notifier;
    private final DelayedWorkScheduler scheduler;
    private final Clock clock;
    private final long baseRetryDelayMillis;
    private final long maxRetryDelayMillis;

    private State state = State.INACTIVE;
    private long retryDelayMillis;
    private FetchJob registrationJob;

    public RegistrationTokenFetcher(DeviceManagementService service,
                                    PolicyCache cache,
                                    IdentityStore identityStore,
                                    PolicyNotifier notifier,
                                    DelayedWorkScheduler scheduler,
                                    Clock clock,
                                    Duration retryDelay,
                                    Duration maxRetryDelay) {
        this.service = service;
        this.cache = cache;
        this.identityStore = identityStore;
        this.notifier = notifier;
        this.scheduler = scheduler;
        this.clock = clock;
        this.baseRetryDelayMillis = retryDelay.toMillis();
        this.maxRetryDelayMillis = maxRetryDelay.toMillis();
        this.retryDelayMillis = baseRetryDelayMillis;
    }

    public State getState() {
        return state;
    }

    @Override
    public void fetchToken() {
        scheduler.cancelDelayedWork();
        cancelJob();
        setState(State.REQUESTING);

        DeviceManagementRequest.RegisterRequest registerRequest = new DeviceManagementRequest.RegisterRequest(
            identityStore.policyType().getWireValue(),
            identityStore.machineId().isEmpty() ? null : identityStore.machineId(),
            identityStore.machineModel().isEmpty() ? null : identityStore.machineModel()
        );
        FetchJob job = service.createJob(JobType.REGISTRATION)
            .setAuthToken(identityStore.authToken())
            .setClientId(identityStore.deviceId())
            .setUserAffiliation(identityStore.userAffiliation())
            .setRequest(DeviceManagementRequest.register(registerRequest));
        registrationJob = job;
        log.info("Registering for {} policy", identityStore.policyType().getDomain());
        job.start(this::onRegistrationCompleted);
    }

    @Override
    public void setUnmanagedState() {
        cache.setUnmanaged(clock.instant());
        setState(State.UNMANAGED);
    }

    @Override
    public void setSerialNumberInvalidState() {
        setState(State.BAD_SERIAL_NUMBER);
    }

    @Override
    public void setMissingLicensesState() {
        setState(State.MISSING_LICENSES);
    }

    @Override
    public void close() {
        scheduler.cancelDelayedWork();
        cancelJob();
    }

    void onRegistrationCompleted(DeviceManagementStatus status, DeviceManagementResponse response) {
        registrationJob = null;
        if (status == DeviceManagementStatus.SUCCESS) {
            String token = response != null && response.registerResponse() != null
                ? response.registerResponse().deviceManagementToken()
                : null;
            if (token != null && !token.isEmpty()) {
                setState(State.TOKEN_AVAILABLE);
                identityStore.setDeviceToken(token);
                return;
            }
            status = DeviceManagementStatus.RESPONSE_DECODING_ERROR;
        }

        log.warn("Registration for {} policy failed with {}", identityStore.policyType().getDomain(), status);
        switch (status) {
            case SERVICE_MANAGEMENT_NOT_SUPPORTED -> setUnmanagedState();
            case SERVICE_INVALID_SERIAL_NUMBER -> setSerialNumberInvalidState();
            case SERVICE_MISSING_LICENSES -> setMissingLicensesState();
            case SERVICE_MANAGEMENT_TOKEN_INVALID -> setState(State.BAD_AUTH);
            case REQUEST_FAILED, TEMPORARY_UNAVAILABLE -> setState(State.TEMPORARY_ERROR);
            default -> setState(State.ERROR);
        }
    }

    private void setState(State newState) {
        state = newState;
        switch (state) {
            case INACTIVE, REQUESTING -> {
                return;
            }
            case TOKEN_AVAILABLE -> {
                retryDelayMillis = baseRetryDelayMillis;
                notifier.inform(SubsystemState.TOKEN_FETCHED, ErrorDetails.NO_DETAILS, NotifierSource.TOKEN_FETCHER);
                return;
            }
            case UNMANAGED -> notifier.inform(
                SubsystemState.UNMANAGED, ErrorDetails.NO_DETAILS, NotifierSource.TOKEN_FETCHER);
            case BAD_SERIAL_NUMBER -> notifier.inform(
                SubsystemState.UNENROLLED, ErrorDetails.BAD_SERIAL_NUMBER, NotifierSource.TOKEN_FETCHER);
            case MISSING_LICENSES -> notifier.inform(
                SubsystemState.UNENROLLED, ErrorDetails.MISSING_LICENSES, NotifierSource.TOKEN_FETCHER);
            case BAD_AUTH -> notifier.inform(
                SubsystemState.BAD_GAIA_TOKEN, ErrorDetails.NO_DETAILS, NotifierSource.TOKEN_FETCHER);
            case TEMPORARY_ERROR, ERROR -> {
                notifier.inform(SubsystemState.NETWORK_ERROR, ErrorDetails.DMTOKEN_NETWORK_ERROR,
                    NotifierSource.TOKEN_FETCHER);
                long delay = state == State.ERROR ? maxRetryDelayMillis : retryDelayMillis;
                retryDelayMillis = Math.min(retryDelayMillis * 2, maxRetryDelayMillis);
                scheduler.postDelayedWork(this::fetchToken, delay);
            }
        }
        // Consumers blocked on the cache are released by any definitive outcome.
        cache.setFetchingDone();
    }

    private void cancelJob() {
        if (registrationJob != null) {
            registrationJob.cancel();
            registrationJob = null;
        }
    }
}
