package com.questrail.sensorlink.api;

/**
 * How a wire identifier was associated with a capability.
 */
public enum MappingConfidence
{
    /** The device's fingerprint resolved to a registered profile which maps the key. */
    REGISTRY,

    /** Best-effort guess from well-known id conventions. Lower confidence than {@link #REGISTRY}. */
    CONVENTION,

    /** No association could be made; the value is surfaced without a capability. */
    NONE
}
