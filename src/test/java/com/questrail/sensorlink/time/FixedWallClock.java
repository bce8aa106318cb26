package com.questrail.sensorlink.time;

import java.time.Instant;

/**
 * Wall clock frozen at a fixed instant.
 */
public final class FixedWallClock implements WallClock {

    public static final Instant EPOCH = Instant.parse("2024-05-01T12:00:00Z");

    private Instant now = EPOCH;

    @Override
    public Instant now() {
        return now;
    }

    public void set(Instant now) {
        this.now = now;
    }
}
