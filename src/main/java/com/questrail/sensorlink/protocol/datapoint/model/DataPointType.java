package com.questrail.sensorlink.protocol.datapoint.model;

import java.util.Optional;

/**
 * DataPointType
 * -----------------------------------------------------------------------------
 * The closed set of payload type tags carried in the second header byte of a
 * DataPoint frame.
 *
 * <p>The numeric code is the on-wire value. Every consumer that branches on a
 * type tag does so with an exhaustive {@code switch} over this enum so that a
 * new tag cannot be added without every handler being revisited.</p>
 */
public enum DataPointType
{
    RAW(0x00),
    BOOLEAN(0x01),
    INTEGER32(0x02),
    STRING(0x03),
    ENUMERATED(0x04),
    BITMAP(0x05);

    private static final DataPointType[] BY_CODE = new DataPointType[6];

    static {
        for (DataPointType t : values()) {
            BY_CODE[t.code] = t;
        }
    }

    private final int code;

    DataPointType(int code) {
        this.code = code;
    }

    /**
     * On-wire type code (0x00..0x05).
     */
    public int code() {
        return code;
    }

    /**
     * Resolves an on-wire type code.
     *
     * @param code unsigned byte value read from the frame header
     * @return the matching type, or empty if the code is not defined
     */
    public static Optional<DataPointType> fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE[code]);
    }
}
