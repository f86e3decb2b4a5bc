package com.policysync.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.policysync.cache.InMemoryPolicyCacheStore;
import com.policysync.cache.JsonFilePolicyCacheStore;
import com.policysync.cache.PolicyCache;
import com.policysync.cache.PolicyCacheStore;
import com.policysync.contract.JsonPolicyDecoder;
import com.policysync.contract.PolicyType;
import com.policysync.controller.PolicyController;
import com.policysync.controller.RefreshSettings;
import com.policysync.controller.RegistrationTokenFetcher;
import com.policysync.identity.IdentityStore;
import com.policysync.notifier.PolicyNotifier;
import com.policysync.scheduler.DelayedWorkScheduler;
import com.policysync.transport.DeviceManagementService;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

/**
 * Builds a {@link PolicySubsystem} per domain from the configured settings.
 * Must be called on the policy sequence: the controller starts working as
 * soon as it is constructed.
 */
public class PolicySubsystemFactory {

    private final DeviceManagementService service;
    private final ObjectMapper objectMapper;
    private final PolicySyncProperties properties;
    private final Supplier<DelayedWorkScheduler> schedulers;
    private final Clock clock;
    private final RandomGenerator random;
    private final Executor ioExecutor;
    private final Executor sequence;

    public PolicySubsystemFactory(DeviceManagementService service,
                                  ObjectMapper objectMapper,
                                  PolicySyncProperties properties,
                                  Supplier<DelayedWorkScheduler> schedulers,
                                  Clock clock,
                                  RandomGenerator random,
                                  Executor ioExecutor,
                                  Executor sequence) {
        this.service = service;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.schedulers = schedulers;
        this.clock = clock;
        this.random = random;
        this.ioExecutor = ioExecutor;
        this.sequence = sequence;
    }

    public PolicySubsystem create(PolicyType type) {
        RefreshSettings settings = properties.refreshSettings();
        PolicySyncProperties.Identity bootstrap = type == PolicyType.USER ? properties.user() : properties.device();

        IdentityStore identityStore = new IdentityStore(type);
        identityStore.setUserNameAndAuthToken(bootstrap.userName(), bootstrap.authToken());
        identityStore.setMachineIdAndModel(bootstrap.machineId(), bootstrap.machineModel());
        identityStore.setUserAffiliation(bootstrap.affiliation());
        identityStore.setDeviceToken(bootstrap.deviceToken());
        identityStore.setTokenCacheLoaded();

        PolicyNotifier notifier = new PolicyNotifier();
        PolicyCache cache = new PolicyCache(
            type.getDomain(),
            new JsonPolicyDecoder(objectMapper, type.getScope()),
            storeFor(type),
            notifier,
            clock,
            properties.waitForPolicyFetch(),
            ioExecutor,
            sequence
        );
        RegistrationTokenFetcher tokenFetcher = new RegistrationTokenFetcher(
            service, cache, identityStore, notifier, schedulers.get(), clock,
            settings.errorDelay(), settings.refreshRate());
        PolicyController controller = new PolicyController(
            service, cache, tokenFetcher, identityStore, notifier, schedulers.get(), settings, clock, random);

        cache.load();
        return new PolicySubsystem(type, identityStore, notifier, cache, tokenFetcher, controller);
    }

    private PolicyCacheStore storeFor(PolicyType type) {
        if (properties.cacheDirectory() == null) {
            return new InMemoryPolicyCacheStore();
        }
        return new JsonFilePolicyCacheStore(
            properties.cacheDirectory().resolve(type.getDomain() + "-policy.json"), objectMapper);
    }
}
