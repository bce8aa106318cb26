package com.questrail.sensorlink.normalize;

/**
 * Closed interval {@code [min, max]} of plausible values for a capability.
 */
public record ValueRange(double min, double max)
{
    public static final ValueRange UNBOUNDED = new ValueRange(-Double.MAX_VALUE, Double.MAX_VALUE);

    public ValueRange {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("range bounds must not be NaN");
        }
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " > max " + max);
        }
    }

    public static ValueRange of(double min, double max) {
        return new ValueRange(min, max);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    public boolean encloses(ValueRange other) {
        return other.min >= min && other.max <= max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
