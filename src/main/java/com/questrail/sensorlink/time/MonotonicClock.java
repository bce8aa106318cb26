package com.questrail.sensorlink.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for window and deadline arithmetic.
 *
 * <h2>Binding invariant</h2>
 * Observation windows are measured on a monotonic source. Wall-clock time
 * ({@link WallClock}) is used only for the timestamps exposed in snapshots and
 * observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
