package com.policysync.provider;

public interface PolicyProviderObserver {

    /** The combined policy was recomputed and no refresh is outstanding. */
    void onPolicyUpdated(MultiSourcePolicyProvider provider);

    default void onProviderGoingAway(MultiSourcePolicyProvider provider) {
    }
}
