package com.questrail.sensorlink.profile;

import com.questrail.sensorlink.api.MappingConfidence;
import com.questrail.sensorlink.api.ProtocolPath;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of looking up a wire key for one device.
 *
 * <p>{@link #mappings()} is empty exactly when the confidence is
 * {@link MappingConfidence#NONE}. Several mappings occur only for clusters
 * feeding more than one capability; the first is the primary one.</p>
 */
public record ResolvedMapping(List<CapabilityMapping> mappings, MappingConfidence confidence)
{
    private static final ResolvedMapping UNMAPPED = new ResolvedMapping(List.of(), MappingConfidence.NONE);

    public ResolvedMapping {
        mappings = List.copyOf(mappings);
        Objects.requireNonNull(confidence, "confidence");
        if (mappings.isEmpty() != (confidence == MappingConfidence.NONE)) {
            throw new IllegalArgumentException("confidence " + confidence + " inconsistent with " + mappings.size() + " mapping(s)");
        }
    }

    public static ResolvedMapping unmapped() {
        return UNMAPPED;
    }

    public Optional<CapabilityMapping> primary() {
        return mappings.isEmpty() ? Optional.empty() : Optional.of(mappings.get(0));
    }

    /**
     * Looks up a key in the device's profile first, then in the conventions.
     *
     * @param profile the device's resolved profile, if any
     */
    public static ResolvedMapping resolve(Optional<CapabilityProfile> profile,
                                          ProtocolConventions conventions,
                                          ProtocolPath path,
                                          int key) {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(conventions, "conventions");
        Objects.requireNonNull(path, "path");

        switch (path) {
            case DATA_POINT -> {
                Optional<CapabilityMapping> registered = profile.flatMap(p -> p.dataPoint(key));
                if (registered.isPresent()) {
                    return new ResolvedMapping(List.of(registered.get()), MappingConfidence.REGISTRY);
                }
                return conventions.forDataPoint(key)
                        .map(m -> new ResolvedMapping(List.of(m), MappingConfidence.CONVENTION))
                        .orElse(UNMAPPED);
            }
            case CLUSTER -> {
                List<CapabilityMapping> registered = profile.map(p -> p.cluster(key)).orElse(List.of());
                if (!registered.isEmpty()) {
                    return new ResolvedMapping(registered, MappingConfidence.REGISTRY);
                }
                List<CapabilityMapping> conventional = conventions.forCluster(key);
                return conventional.isEmpty()
                        ? UNMAPPED
                        : new ResolvedMapping(conventional, MappingConfidence.CONVENTION);
            }
        }
        throw new IllegalStateException("unhandled path " + path);
    }
}
