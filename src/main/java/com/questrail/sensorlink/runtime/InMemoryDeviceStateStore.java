package com.questrail.sensorlink.runtime;

import com.questrail.sensorlink.api.DeviceId;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link DeviceStateStore} kept in a map, for tests and for hosts that
 * persist snapshots themselves.
 */
public final class InMemoryDeviceStateStore implements DeviceStateStore
{
    private final Map<DeviceId, PersistedDeviceState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<PersistedDeviceState> load(DeviceId deviceId) {
        return Optional.ofNullable(states.get(Objects.requireNonNull(deviceId, "deviceId")));
    }

    @Override
    public void save(PersistedDeviceState state) {
        Objects.requireNonNull(state, "state");
        states.put(state.deviceId(), state);
    }

    public int size() {
        return states.size();
    }
}
