package com.questrail.telemetry.internal.time;

import java.time.Clock;
import java.time.Instant;

/**
 * {@link WallClock} over the system UTC clock.
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    private final Clock utc = Clock.systemUTC();

    @Override
    public Instant now() {
        return utc.instant();
    }

    @Override
    public long nowEpochMillis() {
        return utc.millis();
    }
}
