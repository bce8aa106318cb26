package com.questrail.sensorlink.observability;

import com.questrail.sensorlink.api.DeviceId;
import com.questrail.sensorlink.arbitration.ProtocolAffinity;

import java.time.Instant;

/**
 * Record emitted when a device's protocol affinity is decided: at the end of
 * the observation window, on restore from persisted state, or by a manual
 * override. A reset followed by a new window emits it again.
 */
public record AffinityDecidedEvent(
    Instant timestamp,
    DeviceId deviceId,
    ProtocolAffinity affinity,
    long clusterHits,
    long dataPointHits,
    boolean restored,
    boolean forced
) {
}
