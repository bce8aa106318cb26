package com.questrail.sensorlink.normalize;

/**
 * What the normalizer had to do to produce a plausible value.
 */
public enum CorrectionKind
{
    /** The configured transform was already in range. */
    NONE,

    /** An alternative divisor brought the value into range. */
    DIVISOR,

    /** An alternative multiplier brought the value into range. */
    MULTIPLIER,

    /** The value was below the valid minimum and was clamped to it. */
    CLAMPED_MIN,

    /** No plausible value could be produced. */
    REJECTED
}
