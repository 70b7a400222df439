package com.questrail.telemetry.internal.time;

/**
 * {@link MonotonicClock} over {@link System#nanoTime()}.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
