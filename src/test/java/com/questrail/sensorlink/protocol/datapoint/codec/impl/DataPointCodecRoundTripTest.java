package com.questrail.sensorlink.protocol.datapoint.codec.impl;

import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;
import com.questrail.sensorlink.protocol.datapoint.value.DataPointValueDecoder;
import com.questrail.sensorlink.protocol.datapoint.value.DecodedValue;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Encode, decode and interpret one DataPoint per type tag in a single batch,
 * and again through a base64 wrapper.
 */
final class DataPointCodecRoundTripTest
{
    private final DefaultDataPointFrameEncoder encoder = new DefaultDataPointFrameEncoder();
    private final DefaultDataPointFrameDecoder decoder = new DefaultDataPointFrameDecoder();
    private final DataPointValueDecoder values = new DataPointValueDecoder();

    private static Map<DataPointType, Object> samples() {
        Map<DataPointType, Object> m = new LinkedHashMap<>();
        m.put(DataPointType.RAW, new byte[] { 0x0A, 0x0B });
        m.put(DataPointType.BOOLEAN, true);
        m.put(DataPointType.INTEGER32, -1234);
        m.put(DataPointType.STRING, "Küche");
        m.put(DataPointType.ENUMERATED, 3);
        m.put(DataPointType.BITMAP, 0b1010);
        return m;
    }

    private static DecodedValue expected(DataPointType type, Object value) {
        return switch (type) {
            case RAW -> new DecodedValue.Raw((byte[]) value);
            case BOOLEAN -> new DecodedValue.Bool((Boolean) value);
            case INTEGER32 -> new DecodedValue.Int((Integer) value, ((Integer) value) & 0xFFFF_FFFFL, 4);
            case STRING -> new DecodedValue.Text((String) value);
            case ENUMERATED -> new DecodedValue.Enumerated((Integer) value);
            case BITMAP -> new DecodedValue.Bitmap((Integer) value);
        };
    }

    @Test
    void everyTypeSurvivesEncodeDecode()
    {
        Map<DataPointType, Object> samples = samples();
        ByteArrayOutputStream batch = new ByteArrayOutputStream();
        int id = 1;
        for (Map.Entry<DataPointType, Object> e : samples.entrySet()) {
            batch.writeBytes(encoder.encode(id++, e.getKey(), e.getValue()));
        }

        assertDecodesTo(samples, decoder.decodeAll(batch.toByteArray()));
        assertDecodesTo(samples, decoder.decodeAll(Base64.getEncoder().encodeToString(batch.toByteArray())));
    }

    @Test
    void integer32BoundariesSurviveEncodeDecode()
    {
        int id = 1;
        for (int v : new int[] { Integer.MIN_VALUE, -1, 0, Integer.MAX_VALUE }) {
            List<DataPointRecord> records = decoder.decodeAll(encoder.encode(id, DataPointType.INTEGER32, v));
            assertEquals(1, records.size());
            assertEquals(expected(DataPointType.INTEGER32, v), values.decode(records.get(0)), "value " + v);

            // the same value handed over as a Long
            records = decoder.decodeAll(encoder.encode(id, DataPointType.INTEGER32, (long) v));
            assertEquals(v, ((DecodedValue.Int) values.decode(records.get(0))).value());
            id++;
        }
    }

    private void assertDecodesTo(Map<DataPointType, Object> samples, List<DataPointRecord> records)
    {
        assertEquals(samples.size(), records.size());
        int i = 0;
        for (Map.Entry<DataPointType, Object> e : samples.entrySet()) {
            DataPointRecord r = records.get(i++);
            assertEquals(i, r.id());
            assertEquals(e.getKey(), r.type());
            assertEquals(expected(e.getKey(), e.getValue()), values.decode(r));
        }
    }
}
