package org.shadowide.st.schedule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link TaskScheduler} driven by a virtual clock. Nothing runs until {@link #advance(long)} moves time past a
 * task's due time; tasks then run on the calling thread in due order.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final List<Entry> pending = new ArrayList<>();
    private long now;
    private long sequence;

    private final class Entry implements ScheduledTask {
        final Runnable task;
        final long dueAt;
        final long order;
        boolean cancelled;
        boolean done;

        Entry(Runnable task, long dueAt, long order) {
            this.task = task;
            this.dueAt = dueAt;
            this.order = order;
        }

        @Override
        public boolean cancel() {
            synchronized (ManualTaskScheduler.this) {
                if (done) {
                    return false;
                }
                cancelled = true;
                done = true;
                pending.remove(this);
                return true;
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done;
        }
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable task, long delayMillis) {
        Entry entry = new Entry(task, now + Math.max(0, delayMillis), sequence++);
        pending.add(entry);
        return entry;
    }

    /**
     * Moves the clock forward and runs every task that became due.
     */
    public void advance(long millis) {
        long target;
        synchronized (this) {
            target = now + millis;
        }
        while (true) {
            Entry next;
            synchronized (this) {
                next = pending.stream()
                        .filter(e -> e.dueAt <= target)
                        .min(Comparator.comparingLong((Entry e) -> e.dueAt).thenComparingLong(e -> e.order))
                        .orElse(null);
                if (next == null) {
                    now = target;
                    return;
                }
                pending.remove(next);
                now = Math.max(now, next.dueAt);
                next.done = true;
            }
            next.task.run();
        }
    }

    public synchronized long now() {
        return now;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }
}
