package com.policysync.scheduler;

/**
 * Runs one piece of work after a delay. Posting new work replaces whatever was
 * pending, so there is never more than one outstanding callback. Callbacks run
 * on the policy sequence.
 */
public interface DelayedWorkScheduler {

    void postDelayedWork(Runnable work, long delayMillis);

    void cancelDelayedWork();
}
