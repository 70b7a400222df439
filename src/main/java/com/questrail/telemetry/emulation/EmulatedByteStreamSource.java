package com.questrail.telemetry.emulation;

import com.questrail.telemetry.codec.FrameEncodeException;
import com.questrail.telemetry.internal.time.MonotonicClock;
import com.questrail.telemetry.internal.time.Sleeper;
import com.questrail.telemetry.internal.time.WallClock;
import com.questrail.telemetry.link.ByteStreamSource;
import com.questrail.telemetry.observability.TelemetryErrorEvent;
import com.questrail.telemetry.observability.TelemetryObservabilitySink;

import java.time.Duration;

/**
 * EmulatedByteStreamSource
 * -----------------------------------------------------------------------------
 * Presents the {@link Emulator} as a byte stream so that emulated frames take
 * the same path through the framer and codec as frames from a vehicle.
 *
 * <p>Ticks are paced at a fixed interval on the reading thread, measured with
 * the monotonic clock. A reader that falls more than one interval behind does
 * not receive a burst of catch-up frames. {@link #close()} is the stop signal:
 * after it every read reports end of stream.</p>
 */
final class EmulatedByteStreamSource implements ByteStreamSource {

    private final Emulator emulator;
    private final long intervalNanos;
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final WallClock wallClock;
    private final TelemetryObservabilitySink observabilitySink;

    private volatile boolean closed;

    private long nextTickAt;
    private byte[] pending;
    private int pendingOffset;

    EmulatedByteStreamSource(Emulator emulator,
                             Duration interval,
                             MonotonicClock clock,
                             Sleeper sleeper,
                             WallClock wallClock,
                             TelemetryObservabilitySink observabilitySink)
    {
        this.emulator = emulator;
        this.intervalNanos = interval.toNanos();
        this.clock = clock;
        this.sleeper = sleeper;
        this.wallClock = wallClock;
        this.observabilitySink = observabilitySink;
        this.nextTickAt = clock.nowNanos();
    }

    @Override
    public int read(byte[] buf, Duration timeout) throws InterruptedException {
        if (closed) {
            return -1;
        }

        if (pending == null) {
            final long now = clock.nowNanos();
            final long wait = nextTickAt - now;

            if (wait > timeout.toNanos()) {
                sleeper.sleep(timeout);
                return closed ? -1 : 0;
            }
            if (wait > 0) {
                sleeper.sleep(Duration.ofNanos(wait));
            }
            if (closed) {
                return -1;
            }

            final long scheduled = nextTickAt + intervalNanos;
            final long tickedAt = clock.nowNanos();
            nextTickAt = scheduled > tickedAt ? scheduled : tickedAt + intervalNanos;

            try {
                pending = emulator.tick().bytes();
                pendingOffset = 0;
            } catch (FrameEncodeException e) {
                observabilitySink.onError(new TelemetryErrorEvent(
                    wallClock.now(),
                    "Emulated tick skipped",
                    e
                ));
                return 0;
            }
        }

        int n = Math.min(buf.length, pending.length - pendingOffset);
        System.arraycopy(pending, pendingOffset, buf, 0, n);
        pendingOffset += n;
        if (pendingOffset == pending.length) {
            pending = null;
        }
        return n;
    }

    @Override
    public void close() {
        closed = true;
    }
}
