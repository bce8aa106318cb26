package com.questrail.sensorlink.observability;

import com.questrail.sensorlink.api.DeviceId;
import com.questrail.sensorlink.api.ProtocolPath;
import com.questrail.sensorlink.protocol.datapoint.value.DecodedValue;

import java.time.Instant;

/**
 * Record emitted when a key has neither a profile mapping nor a convention.
 * The value is still surfaced to the host, without a capability.
 */
public record UnmappedDataPointEvent(
    Instant timestamp,
    DeviceId deviceId,
    ProtocolPath path,
    int key,
    DecodedValue value
) {
}
