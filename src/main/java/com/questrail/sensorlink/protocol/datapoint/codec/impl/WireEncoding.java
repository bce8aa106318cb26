package com.questrail.sensorlink.protocol.datapoint.codec.impl;

/**
 * The wrapper under which a payload arrived.
 */
public enum WireEncoding
{
    BINARY,
    BASE64,
    JSON,
    HEX,
    UTF8
}
