package com.questrail.sensorlink.profile;

import com.questrail.sensorlink.api.CapabilityId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * CapabilityProfile
 * =============================================================================
 * Everything the core knows about one device model: which capabilities it
 * exposes and how its wire keys map onto them.
 *
 * <h2>Structure</h2>
 * <ul>
 *   <li>{@link #capabilities()}: ordered, duplicate-free capability list</li>
 *   <li>{@link #dataPointMap()}: DataPoint id to capability and rule</li>
 *   <li>{@link #clusterMap()}: cluster id to one or more capabilities; a
 *       standardized cluster may feed several capabilities from one report</li>
 *   <li>{@link #options()}: free-form per-model settings for the host</li>
 * </ul>
 *
 * <h2>Soft invariant</h2>
 * Every capability referenced by a mapping should appear in
 * {@link #capabilities()}. A violation is logged at WARN during
 * construction and never rejected, because vendor catalogs are frequently
 * incomplete.
 *
 * <p>Instances are immutable.</p>
 */
public final class CapabilityProfile
{
    private static final Logger log = LoggerFactory.getLogger(CapabilityProfile.class);

    private final List<CapabilityId> capabilities;
    private final Map<Integer, CapabilityMapping> dataPointMap;
    private final Map<Integer, List<CapabilityMapping>> clusterMap;
    private final Map<String, Object> options;

    private CapabilityProfile(Builder b) {
        this.capabilities = List.copyOf(new LinkedHashSet<>(b.capabilities));
        this.dataPointMap = Collections.unmodifiableMap(new LinkedHashMap<>(b.dataPointMap));

        Map<Integer, List<CapabilityMapping>> clusters = new LinkedHashMap<>();
        b.clusterMap.forEach((k, v) -> clusters.put(k, List.copyOf(v)));
        this.clusterMap = Collections.unmodifiableMap(clusters);

        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(b.options));

        Set<CapabilityId> missing = new LinkedHashSet<>();
        dataPointMap.values().forEach(m -> collectMissing(m, missing));
        clusterMap.values().forEach(list -> list.forEach(m -> collectMissing(m, missing)));
        if (!missing.isEmpty()) {
            log.warn("Profile maps capabilities {} that are not in its capability list {}", missing, capabilities);
        }
    }

    private void collectMissing(CapabilityMapping mapping, Set<CapabilityId> missing) {
        if (!capabilities.contains(mapping.capability())) {
            missing.add(mapping.capability());
        }
    }

    public List<CapabilityId> capabilities() {
        return capabilities;
    }

    public Map<Integer, CapabilityMapping> dataPointMap() {
        return dataPointMap;
    }

    public Map<Integer, List<CapabilityMapping>> clusterMap() {
        return clusterMap;
    }

    public Map<String, Object> options() {
        return options;
    }

    public Optional<CapabilityMapping> dataPoint(int id) {
        return Optional.ofNullable(dataPointMap.get(id));
    }

    public List<CapabilityMapping> cluster(int clusterId) {
        return clusterMap.getOrDefault(clusterId, List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-filled with this profile, used for inheritance.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.capabilities.addAll(capabilities);
        b.dataPointMap.putAll(dataPointMap);
        clusterMap.forEach((k, v) -> b.clusterMap.put(k, new ArrayList<>(v)));
        b.options.putAll(options);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CapabilityProfile other)) return false;
        return capabilities.equals(other.capabilities)
                && dataPointMap.equals(other.dataPointMap)
                && clusterMap.equals(other.clusterMap)
                && options.equals(other.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capabilities, dataPointMap, clusterMap, options);
    }

    @Override
    public String toString() {
        return "CapabilityProfile{capabilities=" + capabilities
                + ", dataPoints=" + dataPointMap.keySet()
                + ", clusters=" + clusterMap.keySet() + "}";
    }

    public static final class Builder {
        private final List<CapabilityId> capabilities = new ArrayList<>();
        private final Map<Integer, CapabilityMapping> dataPointMap = new LinkedHashMap<>();
        private final Map<Integer, List<CapabilityMapping>> clusterMap = new LinkedHashMap<>();
        private final Map<String, Object> options = new LinkedHashMap<>();

        private Builder() {}

        public Builder capability(CapabilityId capability) {
            capabilities.add(Objects.requireNonNull(capability, "capability"));
            return this;
        }

        public Builder capability(String capability) {
            return capability(CapabilityId.of(capability));
        }

        public Builder capabilities(List<CapabilityId> list) {
            list.forEach(this::capability);
            return this;
        }

        /**
         * Maps a DataPoint id, replacing any earlier mapping for the same id.
         */
        public Builder dataPoint(int id, CapabilityMapping mapping) {
            if (id < 0 || id > 0xFF) {
                throw new IllegalArgumentException("DataPoint id must be 0-255: " + id);
            }
            dataPointMap.put(id, Objects.requireNonNull(mapping, "mapping"));
            return this;
        }

        /**
         * Maps a cluster id, replacing any earlier mappings for the same cluster.
         */
        public Builder cluster(int clusterId, List<CapabilityMapping> mappings) {
            if (clusterId < 0 || clusterId > 0xFFFF) {
                throw new IllegalArgumentException("cluster id must be 0-0xFFFF: " + clusterId);
            }
            if (mappings.isEmpty()) {
                throw new IllegalArgumentException("cluster " + clusterId + " needs at least one mapping");
            }
            clusterMap.put(clusterId, new ArrayList<>(mappings));
            return this;
        }

        public Builder option(String key, Object value) {
            options.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public boolean hasCapabilities() {
            return !capabilities.isEmpty();
        }

        public CapabilityProfile build() {
            return new CapabilityProfile(this);
        }
    }
}
