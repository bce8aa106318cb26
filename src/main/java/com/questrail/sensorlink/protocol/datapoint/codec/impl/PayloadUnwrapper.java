package com.questrail.sensorlink.protocol.datapoint.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PayloadUnwrapper
 * -----------------------------------------------------------------------------
 * Reduces the many shapes a private-channel payload may take to plain bytes.
 *
 * <p>Binary containers ({@code byte[]}, {@link ByteBuf}, {@link ByteBuffer})
 * are copied as-is. Parsed JSON shapes ({@link List}, {@link Map},
 * {@link JsonNode}) must hold integers 0..255, directly or under a
 * {@code data} field. Text is resolved in priority order
 * base64, JSON, hex, UTF-8; the first strategy yielding a non-empty,
 * well-formed sequence wins. Whitespace between hex digits is ignored.</p>
 *
 * <p>Reading a {@code ByteBuf} or {@code ByteBuffer} does not move its
 * position.</p>
 */
public final class PayloadUnwrapper
{
    /** Bytes together with the wrapper they were recovered from. */
    public record Unwrapped(byte[] bytes, WireEncoding encoding) {}

    private final ObjectMapper mapper;

    public PayloadUnwrapper() {
        this(new ObjectMapper());
    }

    public PayloadUnwrapper(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @return the unwrapped bytes, or empty if {@code input} is of an
     *         unsupported type or a structured shape holds invalid values
     */
    public Optional<Unwrapped> unwrap(Object input)
    {
        if (input == null) {
            return Optional.of(new Unwrapped(new byte[0], WireEncoding.BINARY));
        }
        if (input instanceof byte[] bytes) {
            return binary(bytes.clone());
        }
        if (input instanceof ByteBuf buf) {
            return binary(ByteBufUtil.getBytes(buf));
        }
        if (input instanceof ByteBuffer nio) {
            final ByteBuffer view = nio.duplicate();
            final byte[] bytes = new byte[view.remaining()];
            view.get(bytes);
            return binary(bytes);
        }
        if (input instanceof CharSequence text) {
            return Optional.of(unwrapText(text.toString()));
        }
        if (input instanceof JsonNode node) {
            return fromJson(node);
        }
        if (input instanceof List<?> || input instanceof Map<?, ?>) {
            try {
                return fromJson(mapper.valueToTree(input));
            }
            catch (IllegalArgumentException unconvertible) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<Unwrapped> binary(byte[] bytes) {
        return Optional.of(new Unwrapped(bytes, WireEncoding.BINARY));
    }

    private Unwrapped unwrapText(String raw)
    {
        final String text = raw.trim();
        if (text.isEmpty()) {
            return new Unwrapped(new byte[0], WireEncoding.UTF8);
        }

        Optional<byte[]> bytes = tryBase64(text);
        if (bytes.isPresent()) {
            return new Unwrapped(bytes.get(), WireEncoding.BASE64);
        }

        bytes = tryJson(text);
        if (bytes.isPresent()) {
            return new Unwrapped(bytes.get(), WireEncoding.JSON);
        }

        bytes = tryHex(text);
        if (bytes.isPresent()) {
            return new Unwrapped(bytes.get(), WireEncoding.HEX);
        }

        return new Unwrapped(raw.getBytes(StandardCharsets.UTF_8), WireEncoding.UTF8);
    }

    private static Optional<byte[]> tryBase64(String text)
    {
        final byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(text);
        }
        catch (IllegalArgumentException notBase64) {
            return Optional.empty();
        }
        return plausible(decoded);
    }

    private Optional<byte[]> tryJson(String text)
    {
        final char first = text.charAt(0);
        if (first != '[' && first != '{') {
            return Optional.empty();
        }
        final JsonNode node;
        try {
            node = mapper.readTree(text);
        }
        catch (JsonProcessingException notJson) {
            return Optional.empty();
        }
        return fromJson(node).map(Unwrapped::bytes).filter(b -> b.length > 0);
    }

    private static Optional<byte[]> tryHex(String text)
    {
        // hex dumps are often grouped per byte: "01 01 00 01 01"
        String hex = text.replaceAll("\\s+", "");
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        final byte[] decoded;
        try {
            decoded = ByteBufUtil.decodeHexDump(hex);
        }
        catch (IllegalArgumentException | IndexOutOfBoundsException notHex) {
            return Optional.empty();
        }
        return plausible(decoded);
    }

    private static Optional<byte[]> plausible(byte[] decoded)
    {
        if (decoded.length == 0 || !DataPointFraming.startsWithPlausibleFrame(decoded)) {
            return Optional.empty();
        }
        return Optional.of(decoded);
    }

    private static Optional<Unwrapped> fromJson(JsonNode node)
    {
        JsonNode array = node;
        if (node != null && node.isObject()) {
            array = node.get("data");
        }
        if (array == null || !array.isArray()) {
            return Optional.empty();
        }

        final byte[] bytes = new byte[array.size()];
        for (int i = 0; i < bytes.length; i++) {
            final JsonNode element = array.get(i);
            if (!element.isIntegralNumber() || !element.canConvertToInt()) {
                return Optional.empty();
            }
            final int v = element.intValue();
            if (v < 0 || v > 0xFF) {
                return Optional.empty();
            }
            bytes[i] = (byte) v;
        }
        return Optional.of(new Unwrapped(bytes, WireEncoding.JSON));
    }
}
