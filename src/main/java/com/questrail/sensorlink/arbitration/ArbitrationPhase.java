package com.questrail.sensorlink.arbitration;

/**
 * Lifecycle of a device's protocol arbitration.
 *
 * <p>{@code OBSERVING -> DECIDED} happens exactly once, at the end of the
 * observation window. {@code DECIDED} is terminal for the session.</p>
 */
public enum ArbitrationPhase
{
    OBSERVING,
    DECIDED
}
