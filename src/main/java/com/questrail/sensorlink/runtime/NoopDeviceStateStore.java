package com.questrail.sensorlink.runtime;

import com.questrail.sensorlink.api.DeviceId;

import java.util.Optional;

/**
 * No-op implementation of DeviceStateStore.
 */
enum NoopDeviceStateStore implements DeviceStateStore {
    INSTANCE;

    @Override
    public Optional<PersistedDeviceState> load(DeviceId deviceId) {
        return Optional.empty();
    }

    @Override
    public void save(PersistedDeviceState state) {}
}
