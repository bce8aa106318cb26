package com.questrail.sensorlink.api;

/**
 * The two application-layer paths a device may use to report values.
 */
public enum ProtocolPath
{
    /** Standardized attribute/cluster reports. Keys are cluster ids. */
    CLUSTER,

    /** Vendor DataPoint reports tunneled in the private channel. Keys are DataPoint ids. */
    DATA_POINT
}
