package com.policysync.provider;

import com.policysync.contract.PolicyMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Read view over one provider for preference-style consumers.
 *
 * Keeps the last combined policy and, on every provider update, reports the
 * individual policies whose values changed. Initialization completion is
 * reported once.
 */
public class PolicyValueStore implements PolicyProviderObserver {

    private static final Logger log = LoggerFactory.getLogger(PolicyValueStore.class);

    public interface Observer {
        void onValueChanged(String policyName);

        void onInitializationCompleted();
    }

    private final CopyOnWriteArrayList<Observer> observers = new CopyOnWriteArrayList<>();
    private MultiSourcePolicyProvider provider;
    private PolicyMap snapshot;
    private boolean initializationComplete;

    public PolicyValueStore(MultiSourcePolicyProvider provider) {
        this.provider = provider;
        this.snapshot = provider.getPolicy();
        this.initializationComplete = provider.isInitializationComplete();
        provider.addObserver(this);
    }

    public Optional<Object> getValue(String policyName) {
        return snapshot.getValue(policyName);
    }

    public PolicyMap snapshot() {
        return snapshot;
    }

    public boolean isInitializationComplete() {
        return initializationComplete;
    }

    public void addObserver(Observer observer) {
        observers.addIfAbsent(observer);
    }

    public void removeObserver(Observer observer) {
        observers.remove(observer);
    }

    @Override
    public void onPolicyUpdated(MultiSourcePolicyProvider updated) {
        refresh();
    }

    @Override
    public void onProviderGoingAway(MultiSourcePolicyProvider goingAway) {
        provider = null;
    }

    private void refresh() {
        if (provider == null) {
            return;
        }
        PolicyMap next = provider.getPolicy();
        List<String> changed = next.differingKeys(snapshot);
        snapshot = next;

        for (String name : changed) {
            for (Observer observer : observers) {
                try {
                    observer.onValueChanged(name);
                } catch (RuntimeException ex) {
                    log.warn("Policy value observer failed for {}: {}", name, ex.getMessage());
                }
            }
        }
        if (!changed.isEmpty()) {
            log.debug("{} policy values changed: {}", provider.level().getValue(), changed);
        }

        if (!initializationComplete && provider.isInitializationComplete()) {
            initializationComplete = true;
            for (Observer observer : observers) {
                try {
                    observer.onInitializationCompleted();
                } catch (RuntimeException ex) {
                    log.warn("Policy value observer failed on initialization: {}", ex.getMessage());
                }
            }
        }
    }
}
