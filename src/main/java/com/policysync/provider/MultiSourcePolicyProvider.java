package com.policysync.provider;

import com.policysync.cache.PolicyCache;
import com.policysync.cache.PolicyCacheObserver;
import com.policysync.contract.PolicyLevel;
import com.policysync.contract.PolicyMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Merges several {@link PolicyCache} sources into one policy map at a single level.
 *
 * Caches earlier in the list take precedence: their entries are merged first
 * and later sources only add keys that are still missing.
 *
 * {@link #refreshPolicies()} opens a barrier holding every current cache.
 * While it is open, cache updates recombine the policy but observers are only
 * told once every cache in the barrier has reported or gone away. Updates
 * outside a refresh are passed on immediately.
 *
 * Caches are not owned. They announce their teardown through
 * {@link #onCacheGoingAway}, after which they are dropped from both the list
 * and the barrier.
 */
public class MultiSourcePolicyProvider implements PolicyCacheObserver, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MultiSourcePolicyProvider.class);

    private final PolicyLevel level;
    private final RefreshRequester refreshRequester;
    private final List<PolicyCache> caches = new ArrayList<>();
    private final Set<PolicyCache> pendingCaches = Collections.newSetFromMap(new IdentityHashMap<>());
    private final CopyOnWriteArrayList<PolicyProviderObserver> observers = new CopyOnWriteArrayList<>();

    private PolicyMap combined = PolicyMap.empty();
    private boolean initializationComplete = true;

    public MultiSourcePolicyProvider(PolicyLevel level, RefreshRequester refreshRequester) {
        this.level = level;
        this.refreshRequester = refreshRequester;
    }

    public PolicyLevel level() {
        return level;
    }

    /** Adds a source with the lowest precedence. */
    public void appendCache(PolicyCache cache) {
        caches.add(cache);
        attach(cache);
    }

    /** Adds a source with the highest precedence. */
    public void prependCache(PolicyCache cache) {
        caches.add(0, cache);
        attach(cache);
    }

    public PolicyMap getPolicy() {
        return combined;
    }

    public boolean isInitializationComplete() {
        return initializationComplete;
    }

    /** Number of caches the current refresh is still waiting for. */
    public int pendingCacheCount() {
        return pendingCaches.size();
    }

    public List<PolicyCache> caches() {
        return List.copyOf(caches);
    }

    /**
     * Asks every source to fetch. Observers are notified once all of them have
     * reported; immediately when there are no sources.
     */
    public void refreshPolicies() {
        pendingCaches.clear();
        pendingCaches.addAll(caches);
        if (pendingCaches.isEmpty()) {
            notifyPolicyUpdated();
        } else {
            log.debug("{} provider waiting on {} caches", level.getValue(), pendingCaches.size());
            refreshRequester.requestRefresh();
        }
    }

    @Override
    public void onCacheUpdate(PolicyCache cache) {
        pendingCaches.remove(cache);
        recombineCachesAndTriggerUpdate();
    }

    @Override
    public void onCacheGoingAway(PolicyCache cache) {
        cache.removeObserver(this);
        caches.remove(cache);
        pendingCaches.remove(cache);
        log.info("Policy cache {} removed from {} provider", cache.name(), level.getValue());
        recombineCachesAndTriggerUpdate();
    }

    public void addObserver(PolicyProviderObserver observer) {
        observers.addIfAbsent(observer);
    }

    public void removeObserver(PolicyProviderObserver observer) {
        observers.remove(observer);
    }

    /** Detaches from all caches and tells observers the provider is gone. */
    @Override
    public void close() {
        for (PolicyCache cache : caches) {
            cache.removeObserver(this);
        }
        caches.clear();
        pendingCaches.clear();
        for (PolicyProviderObserver observer : observers) {
            try {
                observer.onProviderGoingAway(this);
            } catch (RuntimeException ex) {
                log.warn("Policy provider observer failed during shutdown of level={}: {}",
                    level.getValue(), ex.getMessage());
            }
        }
        observers.clear();
    }

    void recombineCachesAndTriggerUpdate() {
        if (!initializationComplete) {
            initializationComplete = caches.stream().allMatch(PolicyCache::isReady);
            if (initializationComplete) {
                log.info("{} provider initialization complete", level.getValue());
            }
        }

        PolicyMap merged = PolicyMap.empty();
        for (PolicyCache cache : caches) {
            if (cache.isReady()) {
                merged = merged.mergeFrom(cache.policies());
            }
        }
        combined = merged.filterLevel(level);

        if (pendingCaches.isEmpty()) {
            notifyPolicyUpdated();
        }
    }

    private void attach(PolicyCache cache) {
        cache.addObserver(this);
        initializationComplete &= cache.isReady();
        recombineCachesAndTriggerUpdate();
    }

    private void notifyPolicyUpdated() {
        for (PolicyProviderObserver observer : observers) {
            try {
                observer.onPolicyUpdated(this);
            } catch (RuntimeException ex) {
                log.warn("Policy provider observer failed for level={}: {}", level.getValue(), ex.getMessage());
            }
        }
    }
}
