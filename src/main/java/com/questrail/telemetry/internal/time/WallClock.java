package com.questrail.telemetry.internal.time;

import java.time.Instant;

/**
 * Source of the timestamps carried by frames, readings and observability
 * events. May jump; timing decisions use {@link MonotonicClock}.
 */
public interface WallClock
{
    Instant now();

    /**
     * Frame timestamps travel as epoch milliseconds, so the emulator stamps
     * frames at that precision.
     */
    default long nowEpochMillis()
    {
        return now().toEpochMilli();
    }
}
