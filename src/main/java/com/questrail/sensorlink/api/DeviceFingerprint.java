package com.questrail.sensorlink.api;

import java.util.Locale;
import java.util.Objects;

/**
 * DeviceFingerprint
 * -----------------------------------------------------------------------------
 * The (vendor id, model id) pair reported by a device, identifying its
 * hardware/firmware combination.
 *
 * <p>The fingerprint is an opaque lookup key. Vendors are inconsistent about
 * letter case, so two fingerprints are equal when both parts match
 * case-insensitively. Nothing else is folded: surrounding whitespace is
 * significant. The original spelling is retained for diagnostics.</p>
 *
 * <p>No prefix or wildcard semantics exist here; a fingerprint either matches
 * exactly or not at all.</p>
 */
public final class DeviceFingerprint
{
    private record Key(String vendor, String model) { }

    private final String vendorId;
    private final String modelId;
    private final Key key;

    private DeviceFingerprint(String vendorId, String modelId) {
        this.vendorId = Objects.requireNonNull(vendorId, "vendorId");
        this.modelId = Objects.requireNonNull(modelId, "modelId");
        this.key = new Key(vendorId.toLowerCase(Locale.ROOT), modelId.toLowerCase(Locale.ROOT));
    }

    public static DeviceFingerprint of(String vendorId, String modelId) {
        return new DeviceFingerprint(vendorId, modelId);
    }

    public String vendorId() {
        return vendorId;
    }

    public String modelId() {
        return modelId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceFingerprint other)) return false;
        return key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return vendorId + "/" + modelId;
    }
}
