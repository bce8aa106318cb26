package com.questrail.sensorlink.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Well-known wire key to capability associations, used for devices without
 * a registered profile.
 *
 * <p>Cluster ids follow the standardized attribute protocol and are reliable
 * across vendors. DataPoint ids are vendor-assigned; the table only captures
 * the most common usage, hence the lower {@code CONVENTION} confidence.</p>
 */
public final class ProtocolConventions
{
    private static final ProtocolConventions EMPTY = new ProtocolConventions(Map.of(), Map.of());

    private final Map<Integer, List<CapabilityMapping>> clusters;
    private final Map<Integer, CapabilityMapping> dataPoints;

    public ProtocolConventions(Map<Integer, List<CapabilityMapping>> clusters,
                               Map<Integer, CapabilityMapping> dataPoints) {
        Map<Integer, List<CapabilityMapping>> c = new LinkedHashMap<>();
        clusters.forEach((k, v) -> {
            if (v.isEmpty()) {
                throw new IllegalArgumentException("cluster " + k + " needs at least one mapping");
            }
            c.put(k, List.copyOf(v));
        });
        this.clusters = Collections.unmodifiableMap(c);
        this.dataPoints = Collections.unmodifiableMap(new LinkedHashMap<>(dataPoints));
    }

    public static ProtocolConventions empty() {
        return EMPTY;
    }

    public List<CapabilityMapping> forCluster(int clusterId) {
        return clusters.getOrDefault(clusterId, List.of());
    }

    public Optional<CapabilityMapping> forDataPoint(int dataPointId) {
        return Optional.ofNullable(dataPoints.get(dataPointId));
    }

    public Map<Integer, List<CapabilityMapping>> clusters() {
        return clusters;
    }

    public Map<Integer, CapabilityMapping> dataPoints() {
        return dataPoints;
    }
}
