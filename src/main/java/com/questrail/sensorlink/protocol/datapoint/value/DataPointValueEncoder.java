package com.questrail.sensorlink.protocol.datapoint.value;

import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * DataPointValueEncoder
 * -----------------------------------------------------------------------------
 * Produces the payload bytes for an outbound DataPoint.
 *
 * <p>Widths are fixed on the outbound side: boolean and enumerated are one
 * byte, integer32 and bitmap four bytes big-endian. Accepted Java inputs:</p>
 * <ul>
 *   <li>raw: {@code byte[]} or {@link DecodedValue.Raw}</li>
 *   <li>boolean: {@code Boolean}, or a {@code Number} (non-zero = true)</li>
 *   <li>integer32: integral {@code Number} within the signed 32-bit range,
 *       matching how a 4-byte payload is read back</li>
 *   <li>bitmap / enumerated: non-negative integral {@code Number}</li>
 *   <li>string: any {@code CharSequence}</li>
 * </ul>
 * Any {@link DecodedValue} of the matching type is accepted as well.
 */
public final class DataPointValueEncoder
{
    /**
     * @throws IllegalArgumentException if {@code value} cannot be represented under {@code type}
     */
    public byte[] encode(DataPointType type, Object value)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");

        return switch (type) {
            case RAW -> encodeRaw(value);
            case BOOLEAN -> new byte[] { (byte) (toBoolean(value) ? 1 : 0) };
            case INTEGER32 -> writeInt32(toIntegral(type, value, Integer.MIN_VALUE, Integer.MAX_VALUE));
            case STRING -> encodeString(value);
            case ENUMERATED -> new byte[] { (byte) toIntegral(type, value, 0, 0xFF) };
            case BITMAP -> writeInt32(toIntegral(type, value, 0, 0xFFFF_FFFFL));
        };
    }

    private static byte[] encodeRaw(Object value)
    {
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        if (value instanceof DecodedValue.Raw raw) {
            return raw.bytes();
        }
        throw new IllegalArgumentException("raw DataPoint requires byte[]: " + value.getClass().getName());
    }

    private static byte[] encodeString(Object value)
    {
        if (value instanceof DecodedValue.Text text) {
            return text.value().getBytes(StandardCharsets.UTF_8);
        }
        if (value instanceof CharSequence s) {
            return s.toString().getBytes(StandardCharsets.UTF_8);
        }
        throw new IllegalArgumentException("string DataPoint requires text: " + value.getClass().getName());
    }

    private static boolean toBoolean(Object value)
    {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof DecodedValue.Bool b) {
            return b.value();
        }
        if (value instanceof Number n) {
            return n.longValue() != 0;
        }
        throw new IllegalArgumentException("boolean DataPoint requires Boolean: " + value.getClass().getName());
    }

    private static long toIntegral(DataPointType type, Object value, long min, long max)
    {
        final long v;
        if (value instanceof DecodedValue.Int i) {
            v = i.value();
        }
        else if (value instanceof DecodedValue.Enumerated e) {
            v = e.ordinal();
        }
        else if (value instanceof DecodedValue.Bitmap b) {
            v = b.mask();
        }
        else if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            v = ((Number) value).longValue();
        }
        else {
            throw new IllegalArgumentException(type + " DataPoint requires an integral number: "
                    + value.getClass().getName());
        }

        if (v < min || v > max) {
            throw new IllegalArgumentException(type + " value out of range [" + min + ", " + max + "]: " + v);
        }
        return v;
    }

    private static byte[] writeInt32(long v)
    {
        return new byte[] {
                (byte) (v >>> 24),
                (byte) (v >>> 16),
                (byte) (v >>> 8),
                (byte) v
        };
    }
}
