package com.questrail.sensorlink.runtime;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceId;
import com.questrail.sensorlink.arbitration.ProtocolAffinity;

import java.util.Map;
import java.util.Objects;

/**
 * What survives a restart for one device: learned divisors and the decided
 * protocol affinity ({@link ProtocolAffinity#UNDECIDED} if the window never
 * completed).
 */
public record PersistedDeviceState(
        DeviceId deviceId,
        Map<CapabilityId, Double> learnedDivisors,
        ProtocolAffinity affinity
) {
    public PersistedDeviceState {
        Objects.requireNonNull(deviceId, "deviceId");
        learnedDivisors = Map.copyOf(learnedDivisors);
        Objects.requireNonNull(affinity, "affinity");
    }
}
