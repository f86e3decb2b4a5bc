package com.policysync.notifier;

/**
 * Components that report into a {@link PolicyNotifier}, in the order they normally do work.
 */
public enum NotifierSource {
    TOKEN_FETCHER,
    POLICY_CONTROLLER,
    POLICY_CACHE
}
