package com.questrail.sensorlink.profile;

import com.questrail.sensorlink.normalize.ValueRange;

import java.util.List;
import java.util.Objects;

/**
 * Ranges and correction candidates shared by every scaled rule for one
 * capability, unless the rule overrides them.
 */
public record CapabilityDefaults(
        ValueRange validRange,
        ValueRange typicalRange,
        List<Double> candidateDivisors,
        List<Double> candidateMultipliers
) {
    public CapabilityDefaults {
        Objects.requireNonNull(validRange, "validRange");
        Objects.requireNonNull(typicalRange, "typicalRange");
        candidateDivisors = List.copyOf(candidateDivisors);
        candidateMultipliers = List.copyOf(candidateMultipliers);
    }
}
