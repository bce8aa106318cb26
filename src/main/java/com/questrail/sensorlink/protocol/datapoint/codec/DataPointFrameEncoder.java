package com.questrail.sensorlink.protocol.datapoint.codec;

import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;

import java.util.List;

/**
 * DataPointFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for DataPoint frames, the mechanical inverse of
 * {@link DataPointFrameDecoder} for binary input.
 *
 * <p>Output is always raw binary. Wrapper encodings (base64, hex) are a host
 * transport concern.</p>
 */
public interface DataPointFrameEncoder
{
    /**
     * Encode one DataPoint from a Java value.
     *
     * @throws IllegalArgumentException if {@code id} is outside 0..255, the
     *         value has the wrong Java type for {@code type}, or the payload
     *         exceeds 65535 bytes
     */
    byte[] encode(int id, DataPointType type, Object value);

    /**
     * Encode a record whose payload is already in wire form.
     */
    byte[] encode(DataPointRecord record);

    /**
     * Encode several records back to back in one batch.
     */
    byte[] encodeAll(List<DataPointRecord> records);
}
