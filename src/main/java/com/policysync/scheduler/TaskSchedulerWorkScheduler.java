package com.policysync.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link DelayedWorkScheduler} backed by a Spring {@link TaskScheduler}. The task
 * scheduler must be single-threaded so that callbacks run on the policy sequence.
 */
public class TaskSchedulerWorkScheduler implements DelayedWorkScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskSchedulerWorkScheduler.class);

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private ScheduledFuture<?> pending;
    private long generation;

    public TaskSchedulerWorkScheduler(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public void postDelayedWork(Runnable work, long delayMillis) {
        cancelDelayedWork();
        long scheduledGeneration = ++generation;
        log.debug("Scheduling policy work in {} ms", delayMillis);
        pending = taskScheduler.schedule(() -> {
            // A cancel that raced with the timer firing must still win.
            if (scheduledGeneration != generation) {
                return;
            }
            pending = null;
            work.run();
        }, clock.instant().plusMillis(Math.max(delayMillis, 0)));
    }

    @Override
    public void cancelDelayedWork() {
        generation++;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }
}
