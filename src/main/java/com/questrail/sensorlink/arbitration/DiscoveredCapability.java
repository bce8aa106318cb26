package com.questrail.sensorlink.arbitration;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.MappingConfidence;
import com.questrail.sensorlink.api.ProtocolPath;

import java.util.Objects;

/**
 * A capability seen during observation, with the source that first
 * supplied it.
 *
 * @param path       path of the first report that produced the capability
 * @param key        cluster or DataPoint id of that report
 * @param confidence how that key was associated with the capability
 * @param hits       reports contributing to this capability on any path
 */
public record DiscoveredCapability(
        CapabilityId capability,
        ProtocolPath path,
        int key,
        MappingConfidence confidence,
        long hits
) {
    public DiscoveredCapability {
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(confidence, "confidence");
    }

    DiscoveredCapability hit() {
        return new DiscoveredCapability(capability, path, key, confidence, hits + 1);
    }
}
