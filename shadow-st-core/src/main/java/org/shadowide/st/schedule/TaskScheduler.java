package org.shadowide.st.schedule;

/**
 * Runs callbacks after a delay.
 */
public interface TaskScheduler {

    ScheduledTask schedule(Runnable task, long delayMillis);
}
