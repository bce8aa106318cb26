package com.questrail.sensorlink.time;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} is called.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time.
     *
     * @return number of tasks actually run
     */
    public int runDueTasks() {
        int ran = 0;
        while (!queue.isEmpty() && queue.peek().deadlineNanos <= clock.nowNanos()) {
            Scheduled next = queue.poll();
            if (!next.cancelled.get()) {
                next.done.set(true);
                next.task.run();
                ran++;
            }
        }
        return ran;
    }

    /**
     * Tasks neither run nor cancelled.
     */
    public long pendingCount() {
        return queue.stream().filter(s -> !s.cancelled.get()).count();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicBoolean done = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return !done.get() && cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            return Long.compare(this.deadlineNanos, o.deadlineNanos);
        }
    }
}
