package com.questrail.sensorlink.profile;

import com.questrail.sensorlink.api.DeviceFingerprint;

import java.util.Optional;

/**
 * ProfileRegistry
 * -----------------------------------------------------------------------------
 * Fingerprint to {@link CapabilityProfile} lookup, plus the convention
 * tables used when a fingerprint is not registered.
 *
 * <p>Lookup is exact and case-insensitive. There is no prefix or wildcard
 * matching; an unknown fingerprint is not an error, callers fall back to
 * {@link #conventions()}.</p>
 */
public interface ProfileRegistry
{
    Optional<CapabilityProfile> resolve(DeviceFingerprint fingerprint);

    /**
     * Registers or replaces the profile for a fingerprint.
     */
    void register(DeviceFingerprint fingerprint, CapabilityProfile profile);

    ProtocolConventions conventions();
}
