package com.questrail.sensorlink.observability;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceId;

import java.time.Instant;

/**
 * Record emitted when a divisor becomes learned for a (device, capability)
 * pair.
 */
public record DivisorLearnedEvent(
    Instant timestamp,
    DeviceId deviceId,
    CapabilityId capability,
    double divisor,
    Rule rule
) {
    public enum Rule {
        /** The same corrective divisor succeeded often enough to be trusted. */
        CORRECTION_TALLY,
        /** Most of the recent history lands in the typical range under this divisor. */
        MAJORITY_VOTE,
        /** Seeded from persisted state at attach time. */
        RESTORED
    }
}
