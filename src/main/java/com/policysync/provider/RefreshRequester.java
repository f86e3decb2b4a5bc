package com.policysync.provider;

/**
 * Hook into the layer that owns the policy sources; asked to start fetches on
 * every source when a provider refresh is requested.
 */
@FunctionalInterface
public interface RefreshRequester {

    void requestRefresh();
}
