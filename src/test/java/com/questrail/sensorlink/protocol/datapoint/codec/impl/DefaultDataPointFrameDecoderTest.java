package com.questrail.sensorlink.protocol.datapoint.codec.impl;

import com.questrail.sensorlink.observability.FrameDefectEvent;
import com.questrail.sensorlink.observability.RecordingObservabilitySink;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;
import com.questrail.sensorlink.time.FixedWallClock;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultDataPointFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultDataPointFrameDecoder}.
 *
 * <p>Covers framing, truncation and unknown type codes. Wrapper encodings are
 * covered by {@link PayloadUnwrapperTest}.</p>
 */
final class DefaultDataPointFrameDecoderTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final DefaultDataPointFrameDecoder decoder =
            new DefaultDataPointFrameDecoder(new PayloadUnwrapper(), sink, new FixedWallClock());

    private static byte[] bytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    @Test
    void decodesSingleBooleanFrame()
    {
        List<DataPointRecord> records = decoder.decodeAll(bytes(0x01, 0x01, 0x00, 0x01, 0x01));

        assertEquals(1, records.size());
        DataPointRecord r = records.get(0);
        assertEquals(1, r.id());
        assertEquals(DataPointType.BOOLEAN, r.type());
        assertArrayEquals(bytes(0x01), r.payload());
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void decodesConsecutiveFramesInWireOrderIncludingRepeatedIds()
    {
        byte[] batch = bytes(
                0x02, 0x02, 0x00, 0x04, 0x00, 0x00, 0x0D, 0xAC,
                0x02, 0x02, 0x00, 0x04, 0x00, 0x00, 0x0D, 0xAD,
                0x10, 0x03, 0x00, 0x02, 'o', 'k');

        List<DataPointRecord> records = decoder.decodeAll(batch);

        assertEquals(List.of(2, 2, 16), records.stream().map(DataPointRecord::id).collect(Collectors.toList()));
        assertEquals(DataPointType.STRING, records.get(2).type());
    }

    @Test
    void zeroLengthPayloadIsValid()
    {
        List<DataPointRecord> records = decoder.decodeAll(bytes(0x07, 0x00, 0x00, 0x00));

        assertEquals(1, records.size());
        assertEquals(0, records.get(0).payloadLength());
    }

    @Test
    void truncatedHeaderKeepsDecodedPrefix()
    {
        byte[] batch = bytes(0x01, 0x01, 0x00, 0x01, 0x01, 0x02, 0x02, 0x00);

        List<DataPointRecord> records = decoder.decodeAll(batch);

        assertEquals(1, records.size());
        assertEquals(1, records.get(0).id());

        List<FrameDefectEvent> defects = sink.eventsOfType(FrameDefectEvent.class);
        assertEquals(1, defects.size());
        assertEquals(FrameDefectEvent.Kind.TRUNCATED, defects.get(0).kind());
    }

    @Test
    void truncatedPayloadKeepsDecodedPrefix()
    {
        byte[] batch = bytes(0x01, 0x01, 0x00, 0x01, 0x01, 0x02, 0x02, 0x00, 0x04, 0x00, 0x00);

        List<DataPointRecord> records = decoder.decodeAll(batch);

        assertEquals(1, records.size());
        assertEquals(FrameDefectEvent.Kind.TRUNCATED, sink.eventsOfType(FrameDefectEvent.class).get(0).kind());
    }

    @Test
    void unknownTypeCodeSkipsOnlyThatFrame()
    {
        byte[] batch = bytes(0x05, 0x09, 0x00, 0x01, 0xAA, 0x01, 0x01, 0x00, 0x01, 0x00);

        List<DataPointRecord> records = decoder.decodeAll(batch);

        assertEquals(1, records.size());
        assertEquals(1, records.get(0).id());

        FrameDefectEvent defect = sink.eventsOfType(FrameDefectEvent.class).get(0);
        assertEquals(FrameDefectEvent.Kind.UNKNOWN_TYPE, defect.kind());
        assertEquals(5, defect.dataPointId());
    }

    @Test
    void nullAndEmptyInputYieldNothing()
    {
        assertTrue(decoder.decodeAll(null).isEmpty());
        assertTrue(decoder.decodeAll(new byte[0]).isEmpty());
        assertTrue(decoder.decodeAll("").isEmpty());
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void unsupportedInputTypeIsReportedNotThrown()
    {
        assertTrue(decoder.decodeAll(42).isEmpty());
        assertEquals(FrameDefectEvent.Kind.UNREADABLE_INPUT,
                sink.eventsOfType(FrameDefectEvent.class).get(0).kind());
    }

    @Test
    void byteBufInputIsNotConsumed()
    {
        ByteBuf buf = Unpooled.wrappedBuffer(bytes(0x01, 0x01, 0x00, 0x01, 0x01));
        try {
            assertEquals(1, decoder.decodeAll(buf).size());
            assertEquals(0, buf.readerIndex());
        }
        finally {
            buf.release();
        }
    }

    @Test
    void streamIsLazy()
    {
        byte[] batch = bytes(0x01, 0x01, 0x00, 0x01, 0x01, 0x02, 0x02);

        List<DataPointRecord> first = decoder.decode(batch).limit(1).collect(Collectors.toList());

        assertEquals(1, first.size());
        assertFalse(sink.hasEventOfType(FrameDefectEvent.class), "truncated tail was never read");
    }
}
