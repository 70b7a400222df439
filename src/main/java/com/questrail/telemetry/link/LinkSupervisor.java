package com.questrail.telemetry.link;

import com.questrail.telemetry.codec.frame.TelemetryFrame;
import com.questrail.telemetry.internal.time.MonotonicClock;
import com.questrail.telemetry.internal.time.Sleeper;
import com.questrail.telemetry.internal.time.WallClock;
import com.questrail.telemetry.observability.ConnectAttemptFailedEvent;
import com.questrail.telemetry.observability.LinkStateTransitionEvent;
import com.questrail.telemetry.observability.NullObservabilitySink;
import com.questrail.telemetry.observability.TelemetryErrorEvent;
import com.questrail.telemetry.observability.TelemetryObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * LinkSupervisor
 * =============================================================================
 * Keeps the raw telemetry link alive and feeds every complete frame to the
 * pipeline.
 *
 * <h2>State machine</h2>
 * <pre>
 *   IDLE → CONNECTING ──open ok──→ STREAMING ──error / EOF / stall──→ RECONNECTING
 *             ↑  │                                                        │
 *             │  └─open failed: backoff, stay CONNECTING                  │
 *             └───────────────────────────────────────────────────────────┘
 *   stop() from any state → STOPPED (terminal)
 * </pre>
 *
 * <h2>Threading Model</h2>
 * {@link #start()} runs the loop on a dedicated thread named
 * {@code telemetry-link-supervisor}. Frames are handed to the consumer
 * synchronously on that thread, so a slow consumer slows reading, never the
 * other way round. {@link #run()} executes the same loop on the calling thread,
 * which tests use together with a manual clock and sleeper.
 *
 * <h2>Resource release</h2>
 * The open source is closed on every exit path: link drop, stop request,
 * interrupt and unexpected runtime failure.
 */
public final class LinkSupervisor {

    private static final int READ_CHUNK = 4096;

    private final LinkConnector connector;
    private final StreamFramer framer;
    private final Consumer<TelemetryFrame> frameConsumer;
    private final LinkTimingPolicy timingPolicy;
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final WallClock wallClock;
    private final TelemetryObservabilitySink observabilitySink;

    private final AtomicReference<LinkState> state = new AtomicReference<>(LinkState.IDLE);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong connectFailures = new AtomicLong();
    private final AtomicLong linkDrops = new AtomicLong();

    private volatile boolean stopRequested;
    private volatile ByteStreamSource currentSource;
    private volatile Thread loopThread;

    public LinkSupervisor(LinkConnector connector,
                          StreamFramer framer,
                          Consumer<TelemetryFrame> frameConsumer,
                          LinkTimingPolicy timingPolicy,
                          MonotonicClock clock,
                          Sleeper sleeper,
                          WallClock wallClock,
                          TelemetryObservabilitySink observabilitySink)
    {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.framer = Objects.requireNonNull(framer, "framer");
        this.frameConsumer = Objects.requireNonNull(frameConsumer, "frameConsumer");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the supervisor thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (started.compareAndSet(false, true)) {
            Thread t = new Thread(this::run, "telemetry-link-supervisor");
            t.setDaemon(true);
            loopThread = t;
            t.start();
        }
    }

    /**
     * Requests termination, releases the link and waits for the loop to exit.
     * Safe to call from any thread and more than once.
     */
    public void stop() {
        stopRequested = true;

        ByteStreamSource source = currentSource;
        if (source != null) {
            source.close();
        }

        Thread t = loopThread;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
            try {
                t.join(5000); // Wait up to 5 seconds
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        if (!started.get()) {
            transition(LinkState.STOPPED, null);
        }
    }

    public LinkState state() {
        return state.get();
    }

    /** Total failed connect attempts since construction. */
    public long connectFailures() {
        return connectFailures.get();
    }

    /** Number of times an established link was lost. */
    public long linkDrops() {
        return linkDrops.get();
    }

    /**
     * Runs the supervision loop on the calling thread until {@link #stop()}
     * is called or the thread is interrupted.
     */
    public void run() {
        started.set(true);
        int consecutiveFailures = 0;

        try {
            while (!stopRequested) {
                transition(LinkState.CONNECTING, null);

                final ByteStreamSource source;
                try {
                    source = connector.open(timingPolicy.connectTimeout());
                } catch (LinkException e) {
                    backOff(++consecutiveFailures, e);
                    continue;
                } catch (RuntimeException e) {
                    // A misbehaving connector costs an attempt, never the loop.
                    observabilitySink.onError(new TelemetryErrorEvent(
                        wallClock.now(),
                        "Unexpected failure while connecting to " + connector.description(),
                        e
                    ));
                    backOff(++consecutiveFailures, e);
                    continue;
                }

                consecutiveFailures = 0;
                currentSource = source;
                if (stopRequested) {
                    break;
                }

                transition(LinkState.STREAMING, null);
                final Throwable cause = stream(source);

                currentSource = null;
                source.close();
                framer.reset();

                if (stopRequested) {
                    break;
                }
                linkDrops.incrementAndGet();
                transition(LinkState.RECONNECTING, cause);
            }
        } catch (InterruptedException e) {
            // Expected during shutdown
            if (!stopRequested) {
                Thread.currentThread().interrupt();
            }
        } finally {
            ByteStreamSource source = currentSource;
            currentSource = null;
            if (source != null) {
                source.close();
            }
            transition(LinkState.STOPPED, null);
        }
    }

    private void backOff(int attempt, Throwable cause) throws InterruptedException {
        connectFailures.incrementAndGet();
        Duration delay = timingPolicy.delayFor(attempt);
        observabilitySink.onConnectAttemptFailed(new ConnectAttemptFailedEvent(
            wallClock.now(), attempt, delay, cause));
        sleeper.sleep(delay);
    }

    /**
     * Reads until the link fails or a stop is requested.
     *
     * @return the reason the link was lost, or {@code null} on stop
     */
    private Throwable stream(ByteStreamSource source) throws InterruptedException {
        final byte[] chunk = new byte[READ_CHUNK];
        long lastDataAt = clock.nowNanos();

        try {
            while (!stopRequested) {
                final int n = source.read(chunk, timingPolicy.readTimeout());

                if (n < 0) {
                    return new LinkException("End of stream from " + connector.description());
                }

                if (n == 0) {
                    if (clock.elapsedSince(lastDataAt).compareTo(timingPolicy.stallTimeout()) >= 0) {
                        return new LinkException("No data from " + connector.description()
                            + " for " + timingPolicy.stallTimeout().toMillis() + " ms");
                    }
                    continue;
                }

                lastDataAt = clock.nowNanos();
                for (TelemetryFrame frame : framer.feed(chunk, 0, n)) {
                    frameConsumer.accept(frame);
                }
            }
            return null;
        } catch (LinkException e) {
            return e;
        } catch (RuntimeException e) {
            observabilitySink.onError(new TelemetryErrorEvent(
                wallClock.now(),
                "Unexpected failure while streaming from " + connector.description(),
                e
            ));
            return e;
        }
    }

    private void transition(LinkState next, Throwable cause) {
        LinkState previous = state.getAndUpdate(s -> s == LinkState.STOPPED ? s : next);
        if (previous == next || previous == LinkState.STOPPED) {
            return;
        }
        observabilitySink.onLinkStateTransition(new LinkStateTransitionEvent(
            wallClock.now(), previous, next, cause));
    }
}
