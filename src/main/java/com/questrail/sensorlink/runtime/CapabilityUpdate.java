package com.questrail.sensorlink.runtime;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceId;
import com.questrail.sensorlink.api.MappingConfidence;
import com.questrail.sensorlink.api.ProtocolPath;
import com.questrail.sensorlink.normalize.CorrectionKind;
import com.questrail.sensorlink.normalize.NormalizedValue;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A normalized value ready for the host to set on a device capability.
 *
 * <p>{@link #capability()} is empty for pass-through updates of unmapped
 * keys; {@link #confidence()} is then {@link MappingConfidence#NONE}.</p>
 */
public record CapabilityUpdate(
        DeviceId deviceId,
        Optional<CapabilityId> capability,
        ProtocolPath path,
        int key,
        NormalizedValue value,
        MappingConfidence confidence,
        CorrectionKind correction,
        Instant timestamp
) {
    public CapabilityUpdate {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(confidence, "confidence");
        Objects.requireNonNull(correction, "correction");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
