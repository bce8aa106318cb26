package com.questrail.sensorlink.learn;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceId;

import java.util.Objects;

/**
 * Identity of one value history: a capability on one device.
 */
public record LearnerKey(DeviceId deviceId, CapabilityId capability)
{
    public LearnerKey {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(capability, "capability");
    }

    @Override
    public String toString() {
        return deviceId + "/" + capability;
    }
}
