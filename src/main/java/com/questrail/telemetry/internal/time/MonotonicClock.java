package com.questrail.telemetry.internal.time;

import java.time.Duration;

/**
 * MonotonicClock
 * =============================================================================
 * Nanosecond tick source behind every timing decision in the relay: read
 * stall detection, reconnect backoff and emulator pacing.
 *
 * <p>Readings and events are stamped from {@link WallClock} instead; a wall
 * clock step (NTP, manual change) must never shorten a stall window or burst
 * the emulator.</p>
 */
public interface MonotonicClock
{
    /**
     * Arbitrary-origin nanoseconds; only differences are meaningful.
     */
    long nowNanos();

    /**
     * Time since an earlier {@link #nowNanos()} reading.
     */
    default Duration elapsedSince(long startNanos)
    {
        return Duration.ofNanos(nowNanos() - startNanos);
    }
}
