package com.policysync.connector;

import com.policysync.contract.PolicyLevel;
import com.policysync.contract.PolicyMap;
import com.policysync.contract.PolicyType;
import com.policysync.provider.MultiSourcePolicyProvider;
import com.policysync.provider.PolicyProviderObserver;
import com.policysync.provider.PolicyValueStore;
import com.policysync.provider.RefreshRequester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Owns the policy subsystems and the providers that merge them.
 *
 * User policy takes precedence over device policy. There is one provider per
 * {@link PolicyLevel}. A provider refresh fans out to every subsystem's
 * controller.
 *
 * The object graph lives on the policy sequence. Callers on other threads go
 * through {@link #onSequence(Supplier)} or the future-returning methods.
 */
public class PolicyConnector implements RefreshRequester, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PolicyConnector.class);

    private final PolicySubsystemFactory subsystemFactory;
    private final Executor sequence;
    private final Map<PolicyType, PolicySubsystem> subsystems = new EnumMap<>(PolicyType.class);
    private final Map<PolicyLevel, MultiSourcePolicyProvider> providers = new EnumMap<>(PolicyLevel.class);
    private final Map<PolicyLevel, PolicyValueStore> valueStores = new EnumMap<>(PolicyLevel.class);
    private boolean started;

    public PolicyConnector(PolicySubsystemFactory subsystemFactory, Executor sequence) {
        this.subsystemFactory = subsystemFactory;
        this.sequence = sequence;
    }

    /** Builds the subsystems and providers on the sequence and waits until that is done. */
    public void start() {
        onSequence(() -> {
            initialize();
            return null;
        }).join();
    }

    public <T> CompletableFuture<T> onSequence(Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, sequence);
    }

    public PolicySubsystem subsystem(PolicyType type) {
        PolicySubsystem subsystem = subsystems.get(type);
        if (subsystem == null) {
            throw new IllegalStateException("policy connector is not started");
        }
        return subsystem;
    }

    public List<PolicySubsystem> subsystems() {
        return List.copyOf(subsystems.values());
    }

    public MultiSourcePolicyProvider provider(PolicyLevel level) {
        MultiSourcePolicyProvider provider = providers.get(level);
        if (provider == null) {
            throw new IllegalStateException("policy connector is not started");
        }
        return provider;
    }

    /** Per-policy view of one level; reports which values changed on each update. */
    public PolicyValueStore valueStore(PolicyLevel level) {
        PolicyValueStore values = valueStores.get(level);
        if (values == null) {
            throw new IllegalStateException("policy connector is not started");
        }
        return values;
    }

    @Override
    public void requestRefresh() {
        log.info("Fetching cloud policy for {} subsystems", subsystems.size());
        for (PolicySubsystem subsystem : subsystems.values()) {
            subsystem.refreshPolicies();
        }
    }

    /**
     * Refreshes every source and completes with the combined policy at
     * {@code level} once all of them have reported.
     */
    public CompletableFuture<PolicyMap> refreshPolicies(PolicyLevel level) {
        CompletableFuture<PolicyMap> result = new CompletableFuture<>();
        sequence.execute(() -> {
            try {
                MultiSourcePolicyProvider provider = provider(level);
                provider.addObserver(new PolicyProviderObserver() {
                    @Override
                    public void onPolicyUpdated(MultiSourcePolicyProvider updated) {
                        updated.removeObserver(this);
                        result.complete(updated.getPolicy());
                    }

                    @Override
                    public void onProviderGoingAway(MultiSourcePolicyProvider goingAway) {
                        result.completeExceptionally(new IllegalStateException("policy provider shut down"));
                    }
                });
                provider.refreshPolicies();
            } catch (RuntimeException ex) {
                result.completeExceptionally(ex);
            }
        });
        return result;
    }

    /** Forgets the enrollment of one domain and starts registration over. */
    public CompletableFuture<SubsystemStatus> reset(PolicyType type) {
        return onSequence(() -> {
            PolicySubsystem subsystem = subsystem(type);
            subsystem.reset();
            return subsystem.status();
        });
    }

    @Override
    public void close() {
        onSequence(() -> {
            shutdown();
            return null;
        }).join();
    }

    private void initialize() {
        if (started) {
            return;
        }
        started = true;
        PolicySubsystem device = subsystemFactory.create(PolicyType.DEVICE);
        PolicySubsystem user = subsystemFactory.create(PolicyType.USER);
        subsystems.put(PolicyType.DEVICE, device);
        subsystems.put(PolicyType.USER, user);

        for (PolicyLevel level : PolicyLevel.values()) {
            MultiSourcePolicyProvider provider = new MultiSourcePolicyProvider(level, this);
            provider.appendCache(device.cache());
            provider.prependCache(user.cache());
            providers.put(level, provider);

            PolicyValueStore values = new PolicyValueStore(provider);
            values.addObserver(new PolicyValueStore.Observer() {
                @Override
                public void onValueChanged(String policyName) {
                    log.info("Policy {} changed at {} level", policyName, level.getValue());
                }

                @Override
                public void onInitializationCompleted() {
                    log.info("{} policy initialized", level.getValue());
                }
            });
            valueStores.put(level, values);
        }
        log.info("Policy connector started with {} subsystems", subsystems.size());
    }

    private void shutdown() {
        if (!started) {
            return;
        }
        List<MultiSourcePolicyProvider> toClose = new ArrayList<>(providers.values());
        providers.clear();
        valueStores.clear();
        for (MultiSourcePolicyProvider provider : toClose) {
            provider.close();
        }
        for (PolicySubsystem subsystem : subsystems.values()) {
            subsystem.close();
        }
        subsystems.clear();
        started = false;
        log.info("Policy connector stopped");
    }
}
