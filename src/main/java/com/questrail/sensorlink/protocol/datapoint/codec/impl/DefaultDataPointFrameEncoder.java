package com.questrail.sensorlink.protocol.datapoint.codec.impl;

import com.questrail.sensorlink.protocol.datapoint.codec.DataPointFrameEncoder;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;
import com.questrail.sensorlink.protocol.datapoint.value.DataPointValueEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.List;
import java.util.Objects;

/**
 * DefaultDataPointFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link DataPointFrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultDataPointFrameDecoder}
 * for binary input. Payload bytes come from {@link DataPointValueEncoder};
 * id and length limits are enforced by {@link DataPointRecord}.</p>
 */
public final class DefaultDataPointFrameEncoder implements DataPointFrameEncoder
{
    private final DataPointValueEncoder valueEncoder;

    public DefaultDataPointFrameEncoder()
    {
        this(new DataPointValueEncoder());
    }

    public DefaultDataPointFrameEncoder(DataPointValueEncoder valueEncoder)
    {
        this.valueEncoder = Objects.requireNonNull(valueEncoder, "valueEncoder");
    }

    @Override
    public byte[] encode(int id, DataPointType type, Object value)
    {
        final byte[] payload = valueEncoder.encode(type, value);
        return encode(new DataPointRecord(id, type, payload));
    }

    @Override
    public byte[] encode(DataPointRecord record)
    {
        Objects.requireNonNull(record, "record");
        return encodeAll(List.of(record));
    }

    @Override
    public byte[] encodeAll(List<DataPointRecord> records)
    {
        Objects.requireNonNull(records, "records");

        int size = 0;
        for (DataPointRecord record : records) {
            size += DataPointFraming.HEADER_LENGTH + Objects.requireNonNull(record, "record").payloadLength();
        }

        final ByteBuf out = Unpooled.buffer(size);
        try {
            for (DataPointRecord record : records) {
                DataPointFraming.writeFrame(out, record);
            }
            return ByteBufUtil.getBytes(out);
        }
        finally {
            out.release();
        }
    }
}
