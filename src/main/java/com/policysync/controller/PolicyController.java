package com.policysync.controller;

import com.policysync.cache.PolicyCache;
import com.policysync.contract.DeviceManagementRequest;
import com.policysync.contract.DeviceManagementResponse;
import com.policysync.contract.PolicyFetchResponse;
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
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.random.RandomGenerator;

/**
 * Drives token acquisition and policy fetching for one policy domain.
 *
 * {@link #setState} is the only transition function. Each transition stops the
 * in-flight request and the pending timer, works out when to act next, tells the
 * notifier, and schedules {@link #doWork()} if there is a next step. So there is
 * at most one outstanding timer and one outstanding request at any time.
 *
 * The cache, token fetcher, identity store and notifier are not owned; the
 * caller guarantees they outlive the controller. Everything runs on the policy
 * sequence.
 */
public class PolicyController implements IdentityStore.Observer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PolicyController.class);

    /** Maximum share of the refresh rate, in percent, by which a refresh is moved earlier. */
    static final int REFRESH_DEVIATION_FACTOR_PERCENT = 10;
    static final long REFRESH_DEVIATION_MAX_MILLIS = Duration.ofMinutes(30).toMillis();

    static final String SIGNATURE_TYPE = "SHA1_RSA";

    private final DeviceManagementService service;
    private final PolicyCache cache;
    private final TokenFetcher tokenFetcher;
    private final IdentityStore identityStore;
    private final PolicyNotifier notifier;
    private final DelayedWorkScheduler scheduler;
    private final RefreshSettings settings;
    private final Clock clock;
    private final RandomGenerator random;

    private ControllerState state = ControllerState.TOKEN_UNAVAILABLE;
    private long refreshRateMillis;
    private long effectiveErrorDelayMillis;
    private FetchJob requestJob;
    private boolean closed;

    public PolicyController(DeviceManagementService service,
                            PolicyCache cache,
                            TokenFetcher tokenFetcher,
                            IdentityStore identityStore,
                            PolicyNotifier notifier,
                            DelayedWorkScheduler scheduler,
                            RefreshSettings settings,
                            Clock clock,
                            RandomGenerator random) {
        this.service = service;
        this.cache = cache;
        this.tokenFetcher = tokenFetcher;
        this.identityStore = identityStore;
        this.notifier = notifier;
        this.scheduler = scheduler;
        this.settings = settings;
        this.clock = clock;
        this.random = random;
        this.refreshRateMillis = settings.refreshRate().toMillis();
        this.effectiveErrorDelayMillis = settings.errorDelay().toMillis();

        identityStore.addObserver(this);
        if (identityStore.deviceToken().isEmpty()) {
            setState(ControllerState.TOKEN_UNAVAILABLE);
        } else {
            setState(ControllerState.TOKEN_VALID);
        }
    }

    public ControllerState getState() {
        return state;
    }

    public Duration getRefreshRate() {
        return Duration.ofMillis(refreshRateMillis);
    }

    /** Delay the next error transition will use. */
    public Duration getEffectiveErrorDelay() {
        return Duration.ofMillis(effectiveErrorDelayMillis);
    }

    /** Changes the refresh period; a pending periodic refresh is rescheduled. */
    public void setRefreshRate(Duration refreshRate) {
        if (refreshRate == null || refreshRate.isNegative() || refreshRate.isZero()) {
            throw new IllegalArgumentException("refreshRate must be positive");
        }
        refreshRateMillis = refreshRate.toMillis();
        if (state == ControllerState.POLICY_VALID) {
            setState(ControllerState.POLICY_VALID);
        }
    }

    /** Skips any pending delay and performs the next step now. */
    public void retry() {
        scheduler.cancelDelayedWork();
        doWork();
    }

    public void reset() {
        setState(ControllerState.TOKEN_UNAVAILABLE);
    }

    /**
     * Forces a fetch. Always ends in an outcome the cache hears about, even when
     * there are no credentials to fetch with.
     */
    public void refreshPolicies() {
        if (identityStore.deviceToken().isEmpty()) {
            if (readyToFetchToken()) {
                setState(ControllerState.TOKEN_UNAVAILABLE);
            } else {
                // Nothing to fetch with, but consumers are waiting on an outcome.
                setState(ControllerState.TOKEN_UNMANAGED);
            }
        } else {
            setState(ControllerState.TOKEN_VALID);
        }
    }

    @Override
    public void onDeviceTokenChanged() {
        if (identityStore.deviceToken().isEmpty()) {
            setState(ControllerState.TOKEN_UNAVAILABLE);
        } else {
            setState(ControllerState.TOKEN_VALID);
        }
    }

    @Override
    public void onCredentialsChanged() {
        // An existing device token belongs to the current user, tokens are cached per user.
        if (identityStore.deviceToken().isEmpty()) {
            notifier.inform(SubsystemState.UNENROLLED, ErrorDetails.NO_DETAILS, NotifierSource.POLICY_CONTROLLER);
            effectiveErrorDelayMillis = settings.errorDelay().toMillis();
            setState(ControllerState.TOKEN_UNAVAILABLE);
        }
    }

    /** Cancels pending work and the in-flight request, and stops observing the identity store. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        identityStore.removeObserver(this);
        scheduler.cancelDelayedWork();
        cancelRequest();
    }

    void onPolicyFetchCompleted(DeviceManagementStatus status, DeviceManagementResponse response) {
        requestJob = null;
        if (status == DeviceManagementStatus.SUCCESS
                && (response == null || response.policyResponse() == null)) {
            status = DeviceManagementStatus.RESPONSE_DECODING_ERROR;
        }

        switch (status) {
            case SUCCESS -> applyPolicyResponse(response.policyResponse().responses());
            case SERVICE_DEVICE_NOT_FOUND, SERVICE_DEVICE_ID_CONFLICT, SERVICE_MANAGEMENT_TOKEN_INVALID -> {
                log.warn("Device token for {} policy was rejected ({}), registering again",
                    identityStore.policyType().getDomain(), status);
                setState(ControllerState.TOKEN_ERROR);
            }
            case SERVICE_INVALID_SERIAL_NUMBER -> {
                log.info("Device serial number is no longer enlisted for the domain");
                tokenFetcher.setSerialNumberInvalidState();
                setState(ControllerState.TOKEN_ERROR);
            }
            case SERVICE_MISSING_LICENSES -> {
                log.info("Domain has no licenses left for this device");
                tokenFetcher.setMissingLicensesState();
                setState(ControllerState.TOKEN_ERROR);
            }
            case SERVICE_MANAGEMENT_NOT_SUPPORTED -> {
                log.info("{} policy is no longer managed", identityStore.policyType().getDomain());
                tokenFetcher.setUnmanagedState();
                setState(ControllerState.TOKEN_UNMANAGED);
            }
            case SERVICE_POLICY_NOT_FOUND, REQUEST_INVALID, SERVICE_ACTIVATION_PENDING,
                 RESPONSE_DECODING_ERROR, HTTP_STATUS_ERROR -> {
                log.warn("Policy fetch failed with {}, retrying at the refresh rate", status);
                setState(ControllerState.POLICY_UNAVAILABLE);
            }
            case REQUEST_FAILED, TEMPORARY_UNAVAILABLE -> {
                log.warn("Policy fetch failed temporarily with {}, backing off", status);
                setState(ControllerState.POLICY_ERROR);
            }
        }
    }

    private void applyPolicyResponse(List<PolicyFetchResponse> responses) {
        if (responses == null || responses.isEmpty()) {
            log.warn("Policy fetch succeeded but carried no policy");
            setState(ControllerState.POLICY_UNAVAILABLE);
            return;
        }
        if (responses.size() > 1) {
            log.warn("Policy fetch returned {} policies, only the first is used", responses.size());
        }
        PolicyFetchResponse fetchResponse = responses.get(0);
        if (fetchResponse == null || fetchResponse.hasError()) {
            log.warn("Policy fetch response carried error code {}",
                fetchResponse != null ? fetchResponse.errorCode() : null);
            setState(ControllerState.POLICY_UNAVAILABLE);
            return;
        }
        if (cache.setPolicy(fetchResponse)) {
            setState(ControllerState.POLICY_VALID);
        } else {
            // The previous policy stays authoritative; ask again at the slow rate.
            setState(ControllerState.POLICY_UNAVAILABLE);
        }
    }

    private boolean readyToFetchToken() {
        return identityStore.tokenCacheLoaded()
            && !identityStore.userName().isEmpty()
            && identityStore.hasAuthToken();
    }

    private void fetchToken() {
        if (!readyToFetchToken()) {
            log.debug("Not ready to fetch a device token yet, waiting for credentials");
            return;
        }
        if (!settings.canBeInManagedDomain(identityStore.userName())) {
            setState(ControllerState.TOKEN_UNMANAGED);
            return;
        }
        // Only kept if registration succeeds.
        identityStore.setDeviceId(UUID.randomUUID().toString());
        tokenFetcher.fetchToken();
    }

    private void sendPolicyRequest() {
        if (identityStore.deviceToken().isEmpty()) {
            log.warn("Policy request skipped, no device token");
            return;
        }
        cancelRequest();

        String machineId = cache.machineIdMissing() && !identityStore.machineId().isEmpty()
            ? identityStore.machineId()
            : null;
        Long timestamp = !cache.isUnmanaged()
            ? cache.lastPolicyRefreshTime().map(Instant::toEpochMilli).orElse(null)
            : null;
        Integer keyVersion = cache.getPublicKeyVersion().orElse(null);

        DeviceManagementRequest.PolicyFetchRequest fetchRequest = new DeviceManagementRequest.PolicyFetchRequest(
            identityStore.policyType().getWireValue(),
            SIGNATURE_TYPE,
            machineId,
            timestamp,
            keyVersion
        );

        FetchJob job = service.createJob(JobType.POLICY_FETCH)
            .setDmToken(identityStore.deviceToken())
            .setClientId(identityStore.deviceId())
            .setUserAffiliation(identityStore.userAffiliation())
            .setRequest(DeviceManagementRequest.policy(fetchRequest));
        requestJob = job;
        log.debug("Requesting {} policy", identityStore.policyType().getDomain());
        job.start(this::onPolicyFetchCompleted);
    }

    void doWork() {
        switch (state) {
            case TOKEN_UNAVAILABLE, TOKEN_ERROR -> fetchToken();
            case TOKEN_VALID, POLICY_VALID, POLICY_ERROR, POLICY_UNAVAILABLE -> sendPolicyRequest();
            case TOKEN_UNMANAGED -> { /* waits for a credential change */ }
        }
    }

    void setState(ControllerState newState) {
        if (closed) {
            return;
        }
        ControllerState previous = state;
        state = newState;
        cancelRequest();

        Instant now = clock.instant();
        Instant lastRefresh = cache.lastPolicyRefreshTime().orElse(now);
        Instant refreshAt = null;

        switch (state) {
            case TOKEN_UNMANAGED -> notifier.inform(
                SubsystemState.UNMANAGED, ErrorDetails.NO_DETAILS, NotifierSource.POLICY_CONTROLLER);
            // The notifier waits for the outcome of the next action.
            case TOKEN_UNAVAILABLE, TOKEN_VALID -> refreshAt = now;
            case POLICY_VALID -> {
                // Only a successful fetch resets the backoff.
                effectiveErrorDelayMillis = settings.errorDelay().toMillis();
                refreshAt = lastRefresh.plusMillis(fuzzedRefreshDelay());
                notifier.inform(SubsystemState.SUCCESS, ErrorDetails.NO_DETAILS, NotifierSource.POLICY_CONTROLLER);
            }
            case TOKEN_ERROR, POLICY_ERROR -> {
                ErrorDetails details = state == ControllerState.TOKEN_ERROR
                    ? ErrorDetails.BAD_DMTOKEN
                    : ErrorDetails.POLICY_NETWORK_ERROR;
                notifier.inform(SubsystemState.NETWORK_ERROR, details, NotifierSource.POLICY_CONTROLLER);
                refreshAt = now.plusMillis(effectiveErrorDelayMillis);
                effectiveErrorDelayMillis = Math.min(effectiveErrorDelayMillis * 2, refreshRateMillis);
            }
            case POLICY_UNAVAILABLE -> {
                effectiveErrorDelayMillis = refreshRateMillis;
                refreshAt = now.plusMillis(effectiveErrorDelayMillis);
                notifier.inform(SubsystemState.NETWORK_ERROR, ErrorDetails.POLICY_NETWORK_ERROR,
                    NotifierSource.POLICY_CONTROLLER);
            }
        }

        scheduler.cancelDelayedWork();
        if (refreshAt != null) {
            long delay = Math.max(Duration.between(now, refreshAt).toMillis(), 0);
            log.info("{} policy controller {} -> {}, next step in {} ms",
                identityStore.policyType().getDomain(), previous, state, delay);
            scheduler.postDelayedWork(this::doWork, delay);
        } else {
            log.info("{} policy controller {} -> {}, waiting for credential change",
                identityStore.policyType().getDomain(), previous, state);
        }

        // A fetch attempt has an outcome unless we are only about to start one.
        if (state != ControllerState.TOKEN_UNAVAILABLE && state != ControllerState.TOKEN_VALID) {
            cache.setFetchingDone();
        }
    }

    long fuzzedRefreshDelay() {
        long deviation = Math.min(
            REFRESH_DEVIATION_FACTOR_PERCENT * refreshRateMillis / 100,
            REFRESH_DEVIATION_MAX_MILLIS);
        return refreshRateMillis - random.nextLong(deviation + 1);
    }

    private void cancelRequest() {
        if (requestJob != null) {
            requestJob.cancel();
            requestJob = null;
        }
    }
}
