package com.policysync.cache;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Store used when no cache directory is configured: policy survives cache
 * resets but not a process restart.
 */
public class InMemoryPolicyCacheStore implements PolicyCacheStore {

    private final AtomicReference<CachedPolicy> stored = new AtomicReference<>();

    @Override
    public Optional<CachedPolicy> load() {
        return Optional.ofNullable(stored.get());
    }

    @Override
    public void store(CachedPolicy policy) {
        stored.set(policy);
    }
}
