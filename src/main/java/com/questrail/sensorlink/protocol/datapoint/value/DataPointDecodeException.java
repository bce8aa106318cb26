package com.questrail.sensorlink.protocol.datapoint.value;

/**
 * Indicates that a DataPoint payload could not be interpreted under its
 * declared type tag.
 *
 * This typically reflects:
 * <ul>
 *   <li>A zero-length payload for a type that needs at least one byte</li>
 *   <li>A numeric payload wider than four bytes</li>
 * </ul>
 *
 * Callers on the inbound path catch this, drop the record and log it.
 */
public final class DataPointDecodeException extends RuntimeException
{
    private final int dataPointId;

    public DataPointDecodeException(int dataPointId, String message) {
        super(message);
        this.dataPointId = dataPointId;
    }

    public int dataPointId() {
        return dataPointId;
    }
}
