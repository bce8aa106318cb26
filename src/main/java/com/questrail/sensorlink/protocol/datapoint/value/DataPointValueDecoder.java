package com.questrail.sensorlink.protocol.datapoint.value;

import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * DataPointValueDecoder
 * -----------------------------------------------------------------------------
 * Interprets a {@link DataPointRecord}'s payload according to its type tag.
 *
 * <p>Vendors are inconsistent about integer widths: the same logical
 * {@code integer32} DataPoint is seen on the wire as 1, 2 or 4 bytes. The
 * width is therefore taken from the payload length, not assumed.</p>
 *
 * <table>
 *   <caption>Interpretation per type tag</caption>
 *   <tr><th>Type</th><th>Payload</th><th>Result</th></tr>
 *   <tr><td>raw</td><td>any</td><td>bytes unchanged</td></tr>
 *   <tr><td>boolean</td><td>&ge; 1 byte</td><td>first byte non-zero</td></tr>
 *   <tr><td>integer32</td><td>1..4 bytes</td><td>big-endian; 1/3 bytes unsigned, 2/4 bytes signed</td></tr>
 *   <tr><td>string</td><td>any</td><td>UTF-8</td></tr>
 *   <tr><td>enumerated</td><td>&ge; 1 byte</td><td>first byte as ordinal</td></tr>
 *   <tr><td>bitmap</td><td>1..4 bytes</td><td>big-endian unsigned mask</td></tr>
 * </table>
 *
 * <p>This class is stateless and safe to share across devices and threads.</p>
 */
public final class DataPointValueDecoder
{
    private static final Logger log = LoggerFactory.getLogger(DataPointValueDecoder.class);

    /**
     * Decodes the record's payload.
     *
     * @throws DataPointDecodeException if the payload length is inconsistent with the type tag
     */
    public DecodedValue decode(DataPointRecord record)
    {
        Objects.requireNonNull(record, "record");
        final byte[] payload = record.payload();
        final int id = record.id();

        return switch (record.type()) {
            case RAW -> new DecodedValue.Raw(payload);
            case BOOLEAN -> {
                requireAtLeastOne(id, record.type(), payload);
                yield new DecodedValue.Bool(payload[0] != 0);
            }
            case INTEGER32 -> decodeInteger(id, payload);
            case STRING -> new DecodedValue.Text(new String(payload, StandardCharsets.UTF_8));
            case ENUMERATED -> {
                requireAtLeastOne(id, record.type(), payload);
                yield new DecodedValue.Enumerated(payload[0] & 0xFF);
            }
            case BITMAP -> {
                requireWidth(id, record.type(), payload);
                yield new DecodedValue.Bitmap(readUnsigned(payload));
            }
        };
    }

    /**
     * Lenient variant for the inbound path: a type mismatch drops the record
     * and is logged rather than thrown.
     */
    public Optional<DecodedValue> tryDecode(DataPointRecord record)
    {
        try {
            return Optional.of(decode(record));
        }
        catch (DataPointDecodeException e) {
            log.warn("Dropping DataPoint {}: {}", e.dataPointId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static DecodedValue decodeInteger(int id, byte[] payload)
    {
        requireWidth(id, DataPointType.INTEGER32, payload);
        final long unsigned = readUnsigned(payload);
        final long value = switch (payload.length) {
            case 2 -> (short) unsigned;
            case 4 -> (int) unsigned;
            default -> unsigned;
        };
        return new DecodedValue.Int(value, unsigned, payload.length);
    }

    private static long readUnsigned(byte[] payload)
    {
        long v = 0;
        for (byte b : payload) {
            v = (v << 8) | (b & 0xFF);
        }
        return v;
    }

    private static void requireAtLeastOne(int id, DataPointType type, byte[] payload)
    {
        if (payload.length == 0) {
            throw new DataPointDecodeException(id, type + " payload is empty");
        }
    }

    private static void requireWidth(int id, DataPointType type, byte[] payload)
    {
        if (payload.length < 1 || payload.length > 4) {
            throw new DataPointDecodeException(id,
                    type + " payload must be 1-4 bytes, was " + payload.length);
        }
    }
}
