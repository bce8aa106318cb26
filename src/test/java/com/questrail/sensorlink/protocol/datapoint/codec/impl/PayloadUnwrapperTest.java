package com.questrail.sensorlink.protocol.datapoint.codec.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PayloadUnwrapperTest
{
    private static final byte[] FRAME = { 0x01, 0x01, 0x00, 0x01, 0x01 };

    private final PayloadUnwrapper unwrapper = new PayloadUnwrapper();

    private PayloadUnwrapper.Unwrapped unwrap(Object input) {
        return unwrapper.unwrap(input).orElseThrow();
    }

    @Test
    void base64TextIsDecoded()
    {
        PayloadUnwrapper.Unwrapped u = unwrap("AQEAAQE=");
        assertEquals(WireEncoding.BASE64, u.encoding());
        assertArrayEquals(FRAME, u.bytes());
    }

    @Test
    void hexTextIsDecodedWhenItIsNotPlausibleBase64()
    {
        PayloadUnwrapper.Unwrapped u = unwrap("0101000101");
        assertEquals(WireEncoding.HEX, u.encoding());
        assertArrayEquals(FRAME, u.bytes());

        assertArrayEquals(FRAME, unwrap("0x0101000101").bytes());
    }

    @Test
    void hexGroupedBySpacesIsDecoded()
    {
        PayloadUnwrapper.Unwrapped u = unwrap("01 01 00 01 01");
        assertEquals(WireEncoding.HEX, u.encoding());
        assertArrayEquals(FRAME, u.bytes());

        assertArrayEquals(FRAME, unwrap("0x01 01 00\t01 01\n").bytes());
        assertEquals(WireEncoding.UTF8, unwrap("no hex here").encoding());
    }

    @Test
    void jsonArrayIsDecoded()
    {
        PayloadUnwrapper.Unwrapped u = unwrap("[1, 1, 0, 1, 1]");
        assertEquals(WireEncoding.JSON, u.encoding());
        assertArrayEquals(FRAME, u.bytes());
    }

    @Test
    void jsonObjectWithDataArrayIsDecoded()
    {
        PayloadUnwrapper.Unwrapped u = unwrap("{\"type\":\"Buffer\",\"data\":[1,1,0,1,1]}");
        assertEquals(WireEncoding.JSON, u.encoding());
        assertArrayEquals(FRAME, u.bytes());
    }

    @Test
    void jsonWithOutOfRangeElementFallsBackToUtf8()
    {
        String text = "[1, 300]";
        PayloadUnwrapper.Unwrapped u = unwrap(text);
        assertEquals(WireEncoding.UTF8, u.encoding());
        assertArrayEquals(text.getBytes(StandardCharsets.UTF_8), u.bytes());
    }

    @Test
    void plainTextFallsBackToUtf8()
    {
        PayloadUnwrapper.Unwrapped u = unwrap("hello");
        assertEquals(WireEncoding.UTF8, u.encoding());
        assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), u.bytes());
    }

    @Test
    void parsedJsonShapesAreAccepted() throws Exception
    {
        assertArrayEquals(FRAME, unwrap(List.of(1, 1, 0, 1, 1)).bytes());
        assertArrayEquals(FRAME, unwrap(Map.of("data", List.of(1, 1, 0, 1, 1))).bytes());
        assertArrayEquals(FRAME, unwrap(new ObjectMapper().readTree("{\"data\":[1,1,0,1,1]}")).bytes());
    }

    @Test
    void invalidParsedShapesAreUnreadable()
    {
        assertTrue(unwrapper.unwrap(List.of(1, -1)).isEmpty());
        assertTrue(unwrapper.unwrap(Map.of("payload", List.of(1))).isEmpty());
        assertTrue(unwrapper.unwrap(3.5).isEmpty());
    }

    @Test
    void byteBufferPositionIsPreserved()
    {
        ByteBuffer nio = ByteBuffer.wrap(FRAME);
        assertArrayEquals(FRAME, unwrap(nio).bytes());
        assertEquals(0, nio.position());
    }
}
