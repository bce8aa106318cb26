package com.questrail.sensorlink.time;

import java.time.Instant;

/**
 * Wall-clock source for human-readable timestamps (last-hit times, event
 * timestamps). Never used to measure windows.
 */
public interface WallClock
{
    Instant now();
}
