package com.questrail.sensorlink.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled callback.
 *
 * <p>
 * Each device session owns at most one of these: the handle for the end of its
 * protocol observation window. Tearing the session down must cancel it so no
 * scheduled work outlives the device.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was previously cancelled.
     */
    boolean cancel();
}
