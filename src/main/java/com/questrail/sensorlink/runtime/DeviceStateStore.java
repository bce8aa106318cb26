package com.questrail.sensorlink.runtime;

import com.questrail.sensorlink.api.DeviceId;

import java.util.Optional;

/**
 * Persistence seam for per-device learned state.
 *
 * <p>The engine calls {@link #load(DeviceId)} on attach and
 * {@link #save(PersistedDeviceState)} when an affinity is decided, a
 * divisor is learned, or learning is reset. Both run on the event thread and
 * should not block; hosts backed by slow storage should hand off
 * internally.</p>
 */
public interface DeviceStateStore
{
    Optional<PersistedDeviceState> load(DeviceId deviceId);

    void save(PersistedDeviceState state);

    /**
     * A store that remembers nothing.
     */
    static DeviceStateStore none() {
        return NoopDeviceStateStore.INSTANCE;
    }
}
