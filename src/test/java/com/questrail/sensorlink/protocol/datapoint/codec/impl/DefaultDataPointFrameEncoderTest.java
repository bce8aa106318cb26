package com.questrail.sensorlink.protocol.datapoint.codec.impl;

import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultDataPointFrameEncoderTest
 * -----------------------------------------------------------------------------
 * Byte-exact expectations for the outbound frame layout.
 */
final class DefaultDataPointFrameEncoderTest
{
    private final DefaultDataPointFrameEncoder encoder = new DefaultDataPointFrameEncoder();

    private static byte[] bytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    @Test
    void booleanIsOneByte()
    {
        assertArrayEquals(bytes(0x01, 0x01, 0x00, 0x01, 0x01), encoder.encode(1, DataPointType.BOOLEAN, true));
        assertArrayEquals(bytes(0x01, 0x01, 0x00, 0x01, 0x00), encoder.encode(1, DataPointType.BOOLEAN, false));
    }

    @Test
    void integerIsFourBytesBigEndian()
    {
        assertArrayEquals(bytes(0x18, 0x02, 0x00, 0x04, 0x00, 0x00, 0x0D, 0xAC),
                encoder.encode(24, DataPointType.INTEGER32, 3500));
        assertArrayEquals(bytes(0x18, 0x02, 0x00, 0x04, 0xFF, 0xFF, 0xFF, 0xFE),
                encoder.encode(24, DataPointType.INTEGER32, -2));
    }

    @Test
    void enumeratedAndBitmap()
    {
        assertArrayEquals(bytes(0x04, 0x04, 0x00, 0x01, 0x02), encoder.encode(4, DataPointType.ENUMERATED, 2));
        assertArrayEquals(bytes(0x05, 0x05, 0x00, 0x04, 0x00, 0x00, 0x01, 0x01),
                encoder.encode(5, DataPointType.BITMAP, 0x0101));
    }

    @Test
    void stringAndRaw()
    {
        assertArrayEquals(bytes(0x10, 0x03, 0x00, 0x02, 'o', 'k'), encoder.encode(16, DataPointType.STRING, "ok"));
        assertArrayEquals(bytes(0x11, 0x00, 0x00, 0x03, 0xDE, 0xAD, 0x01),
                encoder.encode(17, DataPointType.RAW, bytes(0xDE, 0xAD, 0x01)));
    }

    @Test
    void encodeAllConcatenatesFrames()
    {
        byte[] out = encoder.encodeAll(List.of(
                new DataPointRecord(1, DataPointType.BOOLEAN, bytes(1)),
                new DataPointRecord(2, DataPointType.RAW, new byte[0])));

        assertArrayEquals(bytes(0x01, 0x01, 0x00, 0x01, 0x01, 0x02, 0x00, 0x00, 0x00), out);
    }

    @Test
    void callerErrorsAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(1, DataPointType.BOOLEAN, "yes"));
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(1, DataPointType.INTEGER32, 1.5));
        assertThrows(IllegalArgumentException.class,
                () -> encoder.encode(1, DataPointType.INTEGER32, 3_000_000_000L));
        assertThrows(IllegalArgumentException.class,
                () -> encoder.encode(1, DataPointType.INTEGER32, (long) Integer.MAX_VALUE + 1));
        assertThrows(IllegalArgumentException.class,
                () -> encoder.encode(1, DataPointType.INTEGER32, (long) Integer.MIN_VALUE - 1));
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(1, DataPointType.ENUMERATED, 256));
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(256, DataPointType.BOOLEAN, true));
        assertThrows(IllegalArgumentException.class,
                () -> encoder.encode(1, DataPointType.RAW, new byte[DataPointRecord.MAX_PAYLOAD_LENGTH + 1]));
    }
}
