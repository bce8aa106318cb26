package com.questrail.sensorlink.protocol.datapoint.codec;

import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;

import java.util.List;
import java.util.stream.Stream;

/**
 * DataPointFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for DataPoint frame batches.
 *
 * <p>This interface defines the inbound boundary between a private-channel
 * payload, in whatever wrapper encoding the host delivered it, and a sequence
 * of structured {@link DataPointRecord}s.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Unwrapping textual and container encodings to raw bytes</li>
 *   <li>Splitting the bytes into frames</li>
 *   <li>Detecting truncation and unknown type codes</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Interpreting payloads (see {@code DataPointValueDecoder})</li>
 *   <li>Mapping DataPoint ids to capabilities</li>
 *   <li>Buffering partial frames across calls</li>
 * </ul>
 *
 * <p>All failures at this layer are framing defects. They are logged and
 * reported but never thrown: a defective batch yields its well-formed
 * prefix.</p>
 */
public interface DataPointFrameDecoder
{
    /**
     * Decode a complete private-channel payload.
     *
     * <p>The returned stream is lazy and can be consumed once. Frames are read
     * as the stream is pulled.</p>
     *
     * @param input raw bytes, a Netty {@code ByteBuf}, a {@code ByteBuffer},
     *              base64/JSON/hex text, a {@code List} of byte values, a
     *              {@code Map} or Jackson {@code JsonNode} with a {@code data}
     *              array; {@code null} yields an empty stream
     * @return records in wire order
     */
    Stream<DataPointRecord> decode(Object input);

    /**
     * Eager variant of {@link #decode(Object)}.
     */
    default List<DataPointRecord> decodeAll(Object input)
    {
        try (Stream<DataPointRecord> records = decode(input)) {
            return records.toList();
        }
    }
}
