package com.questrail.sensorlink.api;

import java.util.Objects;

/**
 * DeviceId
 * -----------------------------------------------------------------------------
 * Opaque, host-assigned identity of one physical device instance.
 *
 * <p>The core never interprets the value. It is used only as a key for
 * per-device state (sessions, value histories, affinity).</p>
 */
public record DeviceId(String value)
{
    public DeviceId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("device id must not be blank");
        }
    }

    public static DeviceId of(String value) {
        return new DeviceId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
