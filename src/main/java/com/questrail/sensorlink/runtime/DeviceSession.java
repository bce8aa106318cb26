package com.questrail.sensorlink.runtime;

import com.questrail.sensorlink.api.DeviceFingerprint;
import com.questrail.sensorlink.api.DeviceId;
import com.questrail.sensorlink.arbitration.ProtocolArbitrator;
import com.questrail.sensorlink.profile.CapabilityProfile;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-device state owned by the engine between attach and detach.
 *
 * <p>The session owns the arbitrator, and through it the observation
 * window's cancellation handle. Closing the session cancels the window.</p>
 */
public final class DeviceSession implements AutoCloseable
{
    private final DeviceId deviceId;
    private final DeviceFingerprint fingerprint;
    private final Optional<CapabilityProfile> profile;
    private final ProtocolArbitrator arbitrator;
    private boolean conventionFallbackLogged;

    DeviceSession(DeviceId deviceId,
                  DeviceFingerprint fingerprint,
                  Optional<CapabilityProfile> profile,
                  ProtocolArbitrator arbitrator) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.arbitrator = Objects.requireNonNull(arbitrator, "arbitrator");
    }

    public DeviceId deviceId() {
        return deviceId;
    }

    public DeviceFingerprint fingerprint() {
        return fingerprint;
    }

    /**
     * Profile resolved at attach time; empty for unregistered fingerprints.
     */
    public Optional<CapabilityProfile> profile() {
        return profile;
    }

    ProtocolArbitrator arbitrator() {
        return arbitrator;
    }

    /**
     * @return true the first time it is called for this session
     */
    boolean markConventionFallbackLogged() {
        if (conventionFallbackLogged) {
            return false;
        }
        conventionFallbackLogged = true;
        return true;
    }

    @Override
    public void close() {
        arbitrator.close();
    }
}
