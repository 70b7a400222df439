package com.questrail.telemetry.emulation;

import com.questrail.telemetry.internal.time.MonotonicClock;
import com.questrail.telemetry.internal.time.Sleeper;
import com.questrail.telemetry.internal.time.WallClock;
import com.questrail.telemetry.link.ByteStreamSource;
import com.questrail.telemetry.link.LinkConnector;
import com.questrail.telemetry.observability.NullObservabilitySink;
import com.questrail.telemetry.observability.TelemetryObservabilitySink;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link LinkConnector} that never fails: every open returns a fresh paced view
 * of the same {@link Emulator}, so tick numbering continues across reconnects.
 */
public final class EmulatedLinkConnector implements LinkConnector {

    private final Emulator emulator;
    private final Duration interval;
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final WallClock wallClock;
    private final TelemetryObservabilitySink observabilitySink;

    public EmulatedLinkConnector(Emulator emulator,
                                 Duration interval,
                                 MonotonicClock clock,
                                 Sleeper sleeper,
                                 WallClock wallClock,
                                 TelemetryObservabilitySink observabilitySink)
    {
        this.emulator = Objects.requireNonNull(emulator, "emulator");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    @Override
    public ByteStreamSource open(Duration timeout) {
        return new EmulatedByteStreamSource(emulator, interval, clock, sleeper, wallClock, observabilitySink);
    }

    @Override
    public String description() {
        return "emulator@" + interval.toMillis() + "ms";
    }
}
