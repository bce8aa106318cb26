package com.questrail.sensorlink.protocol.datapoint.model;

import io.netty.buffer.ByteBufUtil;

import java.util.Arrays;
import java.util.Objects;

/**
 * DataPointRecord
 * -----------------------------------------------------------------------------
 * One decoded DataPoint frame: id, type tag and the undecoded payload bytes.
 *
 * <p>A record is a post-framing, pre-interpretation value. The payload has
 * been cut to exactly the declared length but has not been checked against
 * the type tag; that is the job of {@code DataPointValueDecoder}.</p>
 *
 * <p>The id carries no uniqueness guarantee. A single frame batch may report
 * the same id more than once.</p>
 */
public final class DataPointRecord
{
    /** Largest payload expressible by the 2-byte length field. */
    public static final int MAX_PAYLOAD_LENGTH = 0xFFFF;

    private final int id;
    private final DataPointType type;
    private final byte[] payload;

    public DataPointRecord(int id, DataPointType type, byte[] payload) {
        if (id < 0 || id > 0xFF) {
            throw new IllegalArgumentException("DataPoint id must be 0-255: " + id);
        }
        this.type = Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        if (payload.length > MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException("payload exceeds " + MAX_PAYLOAD_LENGTH + " bytes");
        }
        this.id = id;
        this.payload = payload.clone();
    }

    public int id() {
        return id;
    }

    public DataPointType type() {
        return type;
    }

    /**
     * Returns a defensive copy of the payload.
     */
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataPointRecord other)) return false;
        return id == other.id && type == other.type && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, type) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "DataPointRecord{id=" + id + ", type=" + type + ", payload=" + ByteBufUtil.hexDump(payload) + "}";
    }
}
