package com.questrail.sensorlink.time;

import java.time.Duration;

/**
 * Monotonic clock that only moves when a test tells it to.
 *
 * <p>Pair with {@link DeterministicScheduler} to close observation windows
 * without sleeping.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private long nowNanos;

    @Override
    public synchronized long nowNanos() {
        return nowNanos;
    }

    public synchronized void advanceNanos(long deltaNanos) {
        if (deltaNanos < 0) {
            throw new IllegalArgumentException("monotonic time cannot go backwards: " + deltaNanos);
        }
        nowNanos += deltaNanos;
    }

    public void advance(Duration delta) {
        advanceNanos(delta.toNanos());
    }
}
