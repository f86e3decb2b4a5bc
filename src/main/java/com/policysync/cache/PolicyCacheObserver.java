package com.policysync.cache;

public interface PolicyCacheObserver {

    /** The cache is ready and its contents or fetch outcome changed. */
    void onCacheUpdate(PolicyCache cache);

    /**
     * The cache is being torn down. Called synchronously before any teardown,
     * so holders can drop their reference.
     */
    void onCacheGoingAway(PolicyCache cache);
}
