package com.policysync.cache;

import java.util.Optional;

/**
 * Backing storage of one {@link PolicyCache}. Calls may block and are made off
 * the policy sequence.
 */
public interface PolicyCacheStore {

    /**
     * @return the stored policy, or empty if nothing was stored yet
     * @throws PolicyStoreException if the storage exists but cannot be read
     */
    Optional<CachedPolicy> load();

    /**
     * @throws PolicyStoreException if the policy cannot be written
     */
    void store(CachedPolicy policy);
}
