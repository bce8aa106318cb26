package com.questrail.sensorlink.arbitration;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceId;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of one device's arbitration state.
 *
 * @param restored true if the affinity came from persisted state rather than
 *                 from observation in this session
 * @param forced   true if the affinity was set by a manual override
 */
public record AffinitySnapshot(
        DeviceId deviceId,
        ArbitrationPhase phase,
        ProtocolAffinity affinity,
        long clusterHits,
        long dataPointHits,
        Optional<Instant> lastClusterHit,
        Optional<Instant> lastDataPointHit,
        List<DiscoveredCapability> discoveredCapabilities,
        boolean restored,
        boolean forced
) {
    public AffinitySnapshot {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(affinity, "affinity");
        Objects.requireNonNull(lastClusterHit, "lastClusterHit");
        Objects.requireNonNull(lastDataPointHit, "lastDataPointHit");
        discoveredCapabilities = List.copyOf(discoveredCapabilities);
    }

    public boolean decided() {
        return phase == ArbitrationPhase.DECIDED;
    }

    public Optional<DiscoveredCapability> discovered(CapabilityId capability) {
        return discoveredCapabilities.stream()
                .filter(d -> d.capability().equals(capability))
                .findFirst();
    }
}
