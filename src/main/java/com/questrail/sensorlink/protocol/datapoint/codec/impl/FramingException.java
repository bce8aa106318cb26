package com.questrail.sensorlink.protocol.datapoint.codec.impl;

/**
 * Raised by {@link DataPointFraming} when a frame header or payload runs past
 * the end of the buffer. Never escapes the codec; the decoder converts it
 * into an end-of-batch.
 */
public final class FramingException extends RuntimeException
{
    public FramingException(String message) {
        super(message);
    }
}
