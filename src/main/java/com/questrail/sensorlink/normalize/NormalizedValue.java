package com.questrail.sensorlink.normalize;

import com.questrail.sensorlink.protocol.datapoint.value.DecodedValue;

import java.util.Objects;

/**
 * A value in host units, ready to be set on a capability.
 */
public sealed interface NormalizedValue
        permits NormalizedValue.Numeric, NormalizedValue.Flag, NormalizedValue.Label
{
    record Numeric(double value) implements NormalizedValue {
        public Numeric {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("numeric value must be finite: " + value);
            }
        }
    }

    record Flag(boolean value) implements NormalizedValue {}

    record Label(String value) implements NormalizedValue {
        public Label {
            Objects.requireNonNull(value, "value");
        }
    }

    static NormalizedValue numeric(double value) {
        return new Numeric(value);
    }

    static NormalizedValue flag(boolean value) {
        return new Flag(value);
    }

    static NormalizedValue label(String value) {
        return new Label(value);
    }

    /**
     * Surfaces a decoded value without conversion: numbers as numeric,
     * booleans as flag, text as label, raw bytes as a hex label.
     */
    static NormalizedValue passThrough(DecodedValue value) {
        Objects.requireNonNull(value, "value");
        return switch (value.type()) {
            case RAW -> new Label(((DecodedValue.Raw) value).hex());
            case BOOLEAN -> new Flag(((DecodedValue.Bool) value).value());
            case INTEGER32 -> new Numeric(((DecodedValue.Int) value).value());
            case STRING -> new Label(((DecodedValue.Text) value).value());
            case ENUMERATED -> new Numeric(((DecodedValue.Enumerated) value).ordinal());
            case BITMAP -> new Numeric(((DecodedValue.Bitmap) value).mask());
        };
    }
}
