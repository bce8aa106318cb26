package com.questrail.sensorlink.arbitration;

/**
 * Which protocol path(s) a device actually uses.
 */
public enum ProtocolAffinity
{
    /** Observation window still open. */
    UNDECIDED,

    /** Cluster traffic dominates. */
    CLUSTER_ONLY,

    /** DataPoint traffic dominates. */
    DATA_POINT_ONLY,

    /** Both paths carry comparable traffic, or neither carried any. */
    HYBRID
}
