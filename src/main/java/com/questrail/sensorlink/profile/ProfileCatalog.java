package com.questrail.sensorlink.profile;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceFingerprint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The parsed content of a profile catalog, with inheritance and capability
 * defaults already resolved.
 */
public record ProfileCatalog(
        Map<CapabilityId, CapabilityDefaults> capabilityDefaults,
        ProtocolConventions conventions,
        Map<DeviceFingerprint, CapabilityProfile> profiles
) {
    public ProfileCatalog {
        capabilityDefaults = Collections.unmodifiableMap(new LinkedHashMap<>(capabilityDefaults));
        Objects.requireNonNull(conventions, "conventions");
        profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
    }
}
