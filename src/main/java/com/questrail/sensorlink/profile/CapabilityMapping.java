package com.questrail.sensorlink.profile;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.normalize.ConversionRule;

import java.util.Objects;

/**
 * Associates one wire key (DataPoint id or cluster id) with a capability and
 * the rule that converts its values.
 */
public record CapabilityMapping(CapabilityId capability, ConversionRule rule)
{
    public CapabilityMapping {
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(rule, "rule");
    }

    public static CapabilityMapping of(String capability, ConversionRule rule) {
        return new CapabilityMapping(CapabilityId.of(capability), rule);
    }
}
