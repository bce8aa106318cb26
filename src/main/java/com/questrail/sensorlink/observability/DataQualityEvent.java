package com.questrail.sensorlink.observability;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceId;
import com.questrail.sensorlink.normalize.CorrectionKind;
import com.questrail.sensorlink.protocol.datapoint.value.DecodedValue;

import java.time.Instant;

/**
 * Record emitted when a device reports a value outside its plausible range
 * and the normalizer had to clamp or reject it.
 */
public record DataQualityEvent(
    Instant timestamp,
    DeviceId deviceId,
    CapabilityId capability,
    DecodedValue rawValue,
    CorrectionKind correctionKind,
    String detail
) {
}
