package com.policysync.connector;

import com.policysync.cache.PolicyCache;
import com.policysync.contract.PolicyType;
import com.policysync.controller.PolicyController;
import com.policysync.controller.RegistrationTokenFetcher;
import com.policysync.identity.IdentityStore;
import com.policysync.notifier.PolicyNotifier;

import java.time.Instant;

/**
 * Everything that keeps one policy domain in sync: its credentials, cache,
 * status notifier, token fetcher and controller.
 */
public class PolicySubsystem implements AutoCloseable {

    private final PolicyType type;
    private final IdentityStore identityStore;
    private final PolicyNotifier notifier;
    private final PolicyCache cache;
    private final RegistrationTokenFetcher tokenFetcher;
    private final PolicyController controller;

    public PolicySubsystem(PolicyType type,
                           IdentityStore identityStore,
                           PolicyNotifier notifier,
                           PolicyCache cache,
                           RegistrationTokenFetcher tokenFetcher,
                           PolicyController controller) {
        this.type = type;
        this.identityStore = identityStore;
        this.notifier = notifier;
        this.cache = cache;
        this.tokenFetcher = tokenFetcher;
        this.controller = controller;
    }

    public PolicyType type() {
        return type;
    }

    public IdentityStore identityStore() {
        return identityStore;
    }

    public PolicyNotifier notifier() {
        return notifier;
    }

    public PolicyCache cache() {
        return cache;
    }

    public PolicyController controller() {
        return controller;
    }

    public void refreshPolicies() {
        controller.refreshPolicies();
    }

    /** Drops enrollment: the cache forgets its management state and the controller starts over. */
    public void reset() {
        cache.reset();
        controller.reset();
    }

    public SubsystemStatus status() {
        return new SubsystemStatus(
            type.getDomain(),
            controller.getState(),
            notifier.state(),
            notifier.errorDetails(),
            cache.isReady(),
            cache.isUnmanaged(),
            cache.lastPolicyRefreshTime().map(Instant::toString).orElse(null),
            cache.policies().size()
        );
    }

    /** Controller first, so nothing schedules work against a cache that is going away. */
    @Override
    public void close() {
        controller.close();
        tokenFetcher.close();
        cache.close();
    }
}
