package org.shadowide.st.schedule;

import org.apache.commons.lang3.Validate;

/**
 * Coalesces bursts of submissions: each submission replaces the pending one and restarts the delay, so only the
 * last action of a burst runs.
 */
public class DebouncedTask {

    private final TaskScheduler scheduler;
    private final long delayMillis;
    private ScheduledTask pending;

    public DebouncedTask(TaskScheduler scheduler, long delayMillis) {
        Validate.notNull(scheduler, "scheduler");
        Validate.isTrue(delayMillis >= 0, "delayMillis must not be negative, got %d", delayMillis);
        this.scheduler = scheduler;
        this.delayMillis = delayMillis;
    }

    public synchronized void submit(Runnable action) {
        Validate.notNull(action, "action");
        if (pending != null) {
            pending.cancel();
        }
        pending = scheduler.schedule(action, delayMillis);
    }

    /**
     * Drops the pending action, if any.
     */
    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    public synchronized boolean isPending() {
        return pending != null && !pending.isDone();
    }

    public long getDelayMillis() {
        return delayMillis;
    }
}
