package com.questrail.sensorlink.protocol.datapoint.value;

import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class DataPointValueDecoderTest
{
    private final DataPointValueDecoder decoder = new DataPointValueDecoder();

    private static DataPointRecord record(DataPointType type, int... payload) {
        byte[] bytes = new byte[payload.length];
        for (int i = 0; i < payload.length; i++) {
            bytes[i] = (byte) payload[i];
        }
        return new DataPointRecord(7, type, bytes);
    }

    private DecodedValue.Int integer(int... payload) {
        return (DecodedValue.Int) decoder.decode(record(DataPointType.INTEGER32, payload));
    }

    @Test
    void integerWidthFollowsPayloadLength()
    {
        DecodedValue.Int one = integer(0xFF);
        assertEquals(255, one.value());
        assertEquals(1, one.width());

        DecodedValue.Int two = integer(0xFF, 0xFE);
        assertEquals(-2, two.value());
        assertEquals(65534, two.unsigned());

        DecodedValue.Int three = integer(0x01, 0x00, 0x00);
        assertEquals(65536, three.value());

        DecodedValue.Int four = integer(0xFF, 0xFF, 0xFF, 0xFF);
        assertEquals(-1, four.value());
        assertEquals(0xFFFF_FFFFL, four.unsigned());

        assertEquals(3500, integer(0x00, 0x00, 0x0D, 0xAC).value());
    }

    @Test
    void booleanUsesFirstByte()
    {
        assertEquals(new DecodedValue.Bool(true), decoder.decode(record(DataPointType.BOOLEAN, 0x02)));
        assertEquals(new DecodedValue.Bool(false), decoder.decode(record(DataPointType.BOOLEAN, 0x00, 0x01)));
    }

    @Test
    void stringIsUtf8()
    {
        byte[] utf8 = "21.5 °C".getBytes(StandardCharsets.UTF_8);
        DecodedValue v = decoder.decode(new DataPointRecord(3, DataPointType.STRING, utf8));
        assertEquals(new DecodedValue.Text("21.5 °C"), v);
    }

    @Test
    void enumeratedAndBitmap()
    {
        assertEquals(new DecodedValue.Enumerated(2), decoder.decode(record(DataPointType.ENUMERATED, 0x02)));

        DecodedValue.Bitmap bitmap = (DecodedValue.Bitmap) decoder.decode(record(DataPointType.BITMAP, 0x80, 0x01));
        assertEquals(0x8001, bitmap.mask());
        assertTrue(bitmap.bit(0));
        assertFalse(bitmap.bit(1));
        assertTrue(bitmap.bit(15));
    }

    @Test
    void rawIsUnchanged()
    {
        DecodedValue.Raw raw = (DecodedValue.Raw) decoder.decode(record(DataPointType.RAW, 0xDE, 0xAD));
        assertEquals("dead", raw.hex());
    }

    @Test
    void lengthMismatchThrowsAndLenientPathDrops()
    {
        DataPointRecord emptyBool = record(DataPointType.BOOLEAN);
        DataPointRecord wideInt = record(DataPointType.INTEGER32, 0, 0, 0, 0, 1);

        DataPointDecodeException e = assertThrows(DataPointDecodeException.class, () -> decoder.decode(emptyBool));
        assertEquals(7, e.dataPointId());
        assertThrows(DataPointDecodeException.class, () -> decoder.decode(wideInt));
        assertThrows(DataPointDecodeException.class, () -> decoder.decode(record(DataPointType.BITMAP)));

        assertTrue(decoder.tryDecode(emptyBool).isEmpty());
        assertTrue(decoder.tryDecode(wideInt).isEmpty());
    }

    @Test
    void hostValuesAdaptToDecodedValues()
    {
        assertEquals(DecodedValue.Int.of(21), DecodedValue.fromHost(21));
        assertEquals(DecodedValue.Int.of(2150), DecodedValue.fromHost(2150.0));
        assertEquals(new DecodedValue.Bool(true), DecodedValue.fromHost(Boolean.TRUE));
        assertEquals(new DecodedValue.Text("open"), DecodedValue.fromHost("open"));
        assertThrows(IllegalArgumentException.class, () -> DecodedValue.fromHost(21.5));
        assertThrows(IllegalArgumentException.class, () -> DecodedValue.fromHost(new Object()));
    }
}
