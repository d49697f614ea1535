package org.shadowide.st.schedule;

/**
 * Handle of a delayed callback.
 */
public interface ScheduledTask {

    /**
     * Prevents the callback from running if it has not started yet.
     *
     * @return whether this call cancelled it
     */
    boolean cancel();

    boolean isCancelled();

    /**
     * Ran, failed or was cancelled.
     */
    boolean isDone();
}
