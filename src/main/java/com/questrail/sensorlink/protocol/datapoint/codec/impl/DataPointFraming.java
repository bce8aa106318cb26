package com.questrail.sensorlink.protocol.datapoint.codec.impl;

import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;
import io.netty.buffer.ByteBuf;

/**
 * DataPointFraming
 * -----------------------------------------------------------------------------
 * Frame layout rules for the DataPoint channel.
 *
 * <p>Every frame is a fixed 4-byte header followed by the payload:</p>
 * <ul>
 *   <li>byte 0: DataPoint id</li>
 *   <li>byte 1: type code</li>
 *   <li>bytes 2-3: payload length, unsigned big-endian</li>
 * </ul>
 *
 * <p>This class only cuts frames. It does not interpret type codes beyond
 * the plausibility check used to recognise wrapper encodings.</p>
 */
final class DataPointFraming
{
    static final int HEADER_LENGTH = 4;

    private DataPointFraming() {}

    /**
     * Header plus payload bytes of one frame, with the type code still raw.
     */
    record Frame(int id, int typeCode, byte[] payload) {}

    /**
     * Reads the next frame, advancing the reader index past it.
     *
     * @throws FramingException if the header or the declared payload extends
     *         past the readable bytes; the reader index is then left untouched
     */
    static Frame readFrame(ByteBuf buf)
    {
        final int readable = buf.readableBytes();
        if (readable < HEADER_LENGTH) {
            throw new FramingException("truncated header: " + readable + " byte(s) left");
        }

        final int start = buf.readerIndex();
        final int id = buf.getUnsignedByte(start);
        final int typeCode = buf.getUnsignedByte(start + 1);
        final int length = buf.getUnsignedShort(start + 2);

        if (readable - HEADER_LENGTH < length) {
            throw new FramingException("truncated payload for dp " + id + ": declared "
                    + length + ", available " + (readable - HEADER_LENGTH));
        }

        buf.skipBytes(HEADER_LENGTH);
        final byte[] payload = new byte[length];
        buf.readBytes(payload);
        return new Frame(id, typeCode, payload);
    }

    /**
     * Writes one complete frame for {@code record}.
     */
    static void writeFrame(ByteBuf out, DataPointRecord record)
    {
        out.writeByte(record.id());
        out.writeByte(record.type().code());
        out.writeShort(record.payloadLength());
        out.writeBytes(record.payload());
    }

    /**
     * True if {@code bytes} begins with a complete frame whose type code is
     * known. Used to tell a genuine binary payload from text that merely
     * happens to decode under a wrapper encoding.
     */
    static boolean startsWithPlausibleFrame(byte[] bytes)
    {
        if (bytes.length < HEADER_LENGTH) {
            return false;
        }
        if (DataPointType.fromCode(bytes[1] & 0xFF).isEmpty()) {
            return false;
        }
        final int length = ((bytes[2] & 0xFF) << 8) | (bytes[3] & 0xFF);
        return HEADER_LENGTH + length <= bytes.length;
    }
}
