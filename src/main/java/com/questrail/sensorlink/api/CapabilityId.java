package com.questrail.sensorlink.api;

import java.util.Locale;
import java.util.Objects;

/**
 * CapabilityId
 * -----------------------------------------------------------------------------
 * A {@code CapabilityId} names a normalized, protocol-agnostic property of a
 * device such as {@code measure_temperature}, {@code onoff} or
 * {@code alarm_motion}.
 *
 * <h2>What a CapabilityId IS</h2>
 * <ul>
 *   <li>The unit of identity for normalized values leaving the core</li>
 *   <li>The key under which value histories and learned divisors are kept</li>
 * </ul>
 *
 * <h2>What a CapabilityId IS NOT</h2>
 * <ul>
 *   <li>It is <b>not</b> a DataPoint id or a cluster id</li>
 *   <li>It does <b>not</b> carry a unit or a scaling convention</li>
 * </ul>
 *
 * Wire identifiers are translated into capabilities exclusively by the
 * profile layer ({@code CapabilityProfile}, {@code ProtocolConventions}).
 *
 * <p>Values are stored lower-case so that catalog entries and host-supplied
 * names compare consistently.</p>
 */
public record CapabilityId(String value)
{
    public CapabilityId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("capability id must not be blank");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
    }

    public static CapabilityId of(String value) {
        return new CapabilityId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
