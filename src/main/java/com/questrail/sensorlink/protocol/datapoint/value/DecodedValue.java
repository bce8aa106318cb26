package com.questrail.sensorlink.protocol.datapoint.value;

import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;
import io.netty.buffer.ByteBufUtil;

import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * DecodedValue
 * -----------------------------------------------------------------------------
 * Native interpretation of a DataPoint payload, one variant per
 * {@link DataPointType}.
 *
 * <p>Values arriving on the standardized-cluster path are adapted into the
 * same family through {@link #fromHost(Object)} so that normalization has a
 * single typed input regardless of protocol.</p>
 *
 * <p>Consumers dispatch on {@link #type()} with an exhaustive {@code switch};
 * the variant for a given type is fixed, so the cast in each arm is safe.</p>
 */
public sealed interface DecodedValue
        permits DecodedValue.Raw, DecodedValue.Bool, DecodedValue.Int,
                DecodedValue.Text, DecodedValue.Enumerated, DecodedValue.Bitmap
{
    DataPointType type();

    /**
     * Numeric view used by scaled conversion rules. Booleans, text and raw
     * bytes have none.
     */
    OptionalDouble numeric();

    /** Uninterpreted payload bytes. */
    record Raw(byte[] bytes) implements DecodedValue {
        public Raw {
            bytes = Objects.requireNonNull(bytes, "bytes").clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        public String hex() {
            return ByteBufUtil.hexDump(bytes);
        }

        @Override
        public DataPointType type() {
            return DataPointType.RAW;
        }

        @Override
        public OptionalDouble numeric() {
            return OptionalDouble.empty();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Raw other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "Raw[" + hex() + "]";
        }
    }

    record Bool(boolean value) implements DecodedValue {
        @Override
        public DataPointType type() {
            return DataPointType.BOOLEAN;
        }

        @Override
        public OptionalDouble numeric() {
            return OptionalDouble.empty();
        }
    }

    /**
     * Integer read at the width the payload happened to use.
     *
     * @param value    interpreted value (1 and 3 byte widths unsigned, 2 and 4 signed)
     * @param unsigned the same bits read as unsigned
     * @param width    payload width in bytes (1..4); 4 for host-supplied numbers
     */
    record Int(long value, long unsigned, int width) implements DecodedValue {
        public Int {
            if (width < 1 || width > 8) {
                throw new IllegalArgumentException("width must be 1-8: " + width);
            }
        }

        public static Int of(long value) {
            return new Int(value, value, 4);
        }

        @Override
        public DataPointType type() {
            return DataPointType.INTEGER32;
        }

        @Override
        public OptionalDouble numeric() {
            return OptionalDouble.of(value);
        }
    }

    /** UTF-8 text payload. */
    record Text(String value) implements DecodedValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public DataPointType type() {
            return DataPointType.STRING;
        }

        @Override
        public OptionalDouble numeric() {
            return OptionalDouble.empty();
        }
    }

    record Enumerated(int ordinal) implements DecodedValue {
        public Enumerated {
            if (ordinal < 0 || ordinal > 0xFF) {
                throw new IllegalArgumentException("enum ordinal must be 0-255: " + ordinal);
            }
        }

        @Override
        public DataPointType type() {
            return DataPointType.ENUMERATED;
        }

        @Override
        public OptionalDouble numeric() {
            return OptionalDouble.of(ordinal);
        }
    }

    record Bitmap(long mask) implements DecodedValue {
        public Bitmap {
            if (mask < 0 || mask > 0xFFFF_FFFFL) {
                throw new IllegalArgumentException("bitmap must fit 32 bits: " + mask);
            }
        }

        /**
         * @param bit 0-based bit index, 0 = least significant
         */
        public boolean bit(int bit) {
            if (bit < 0 || bit > 31) {
                throw new IllegalArgumentException("bit index must be 0-31: " + bit);
            }
            return ((mask >>> bit) & 1L) != 0;
        }

        @Override
        public DataPointType type() {
            return DataPointType.BITMAP;
        }

        @Override
        public OptionalDouble numeric() {
            return OptionalDouble.of(mask);
        }
    }

    /**
     * Adapts a value handed over by the host integration layer (typically an
     * already-parsed cluster attribute) into a {@code DecodedValue}.
     *
     * <p>Integral numbers become {@link Int}. Cluster attributes are integers
     * on the wire, so a floating point value is accepted only when it is
     * whole.</p>
     *
     * @throws IllegalArgumentException for unsupported or non-whole values
     */
    static DecodedValue fromHost(Object value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof DecodedValue decoded) {
            return decoded;
        }
        if (value instanceof Boolean b) {
            return new Bool(b);
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return Int.of(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) <= Long.MAX_VALUE) {
                return Int.of((long) d);
            }
            throw new IllegalArgumentException("non-integral host value: " + value);
        }
        if (value instanceof CharSequence s) {
            return new Text(s.toString());
        }
        if (value instanceof byte[] bytes) {
            return new Raw(bytes);
        }
        throw new IllegalArgumentException("unsupported host value type: " + value.getClass().getName());
    }
}
