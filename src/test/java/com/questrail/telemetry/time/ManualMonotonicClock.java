package com.questrail.telemetry.time;

import com.questrail.telemetry.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock that only moves when a test (or {@link RecordingSleeper})
 * advances it. Starts at zero.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long nowNanos() {
        return nanos.get();
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("monotonic time cannot go back: " + delta);
        }
        nanos.addAndGet(delta.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
