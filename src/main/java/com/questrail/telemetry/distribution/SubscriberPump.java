package com.questrail.telemetry.distribution;

import com.questrail.telemetry.internal.time.WallClock;
import com.questrail.telemetry.observability.NullObservabilitySink;
import com.questrail.telemetry.observability.TelemetryErrorEvent;
import com.questrail.telemetry.observability.TelemetryObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SubscriberPump
 * -----------------------------------------------------------------------------
 * Drains one {@link SubscriberHandle} on a dedicated thread into a
 * {@link ReadingBatchSink}.
 *
 * <p>The pump exits on its own once its subscriber is disconnected and the
 * queue is empty. A sink failure is reported and the pump carries on with the
 * next batch; the subscriber stays registered.</p>
 */
public final class SubscriberPump {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(250);

    private final SubscriberHandle handle;
    private final ReadingBatchSink sink;
    private final TelemetryObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong delivered = new AtomicLong();
    private volatile Thread thread;
    private volatile Runnable onFinished = () -> {};

    public SubscriberPump(SubscriberHandle handle,
                          ReadingBatchSink sink,
                          TelemetryObservabilitySink observabilitySink,
                          WallClock wallClock)
    {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Runs {@code hook} on the pump thread once the pump has exited, however it
     * exited. Must be set before {@link #start()}.
     */
    public SubscriberPump whenFinished(Runnable hook) {
        this.onFinished = Objects.requireNonNull(hook, "hook");
        return this;
    }

    /**
     * Starts the pump thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread t = new Thread(this::run, "telemetry-pump-" + handle.name());
            t.setDaemon(true);
            thread = t;
            t.start();
        }
    }

    /**
     * Stops the pump without waiting for queued batches.
     * Blocks until the pump thread terminates.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = thread;
            if (t != null && t != Thread.currentThread()) {
                t.interrupt();
                try {
                    t.join(5000); // Wait up to 5 seconds
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * Waits for the pump to exit on its own, e.g. after a draining hub close.
     */
    public void awaitTermination(Duration timeout) throws InterruptedException {
        Thread t = thread;
        if (t != null) {
            t.join(Math.max(1, timeout.toMillis()));
        }
    }

    public boolean isRunning() {
        Thread t = thread;
        return running.get() && t != null && t.isAlive();
    }

    public SubscriberHandle handle() {
        return handle;
    }

    /** Batches handed to the sink so far. */
    public long deliveredCount() {
        return delivered.get();
    }

    private void run() {
        try {
            while (running.get()) {
                Optional<DeliveredBatch> next = handle.take(POLL_INTERVAL);
                if (next.isEmpty()) {
                    if (handle.state() == SubscriberState.DISCONNECTED) {
                        break;
                    }
                    continue;
                }
                try {
                    sink.deliver(next.get());
                    delivered.incrementAndGet();
                } catch (RuntimeException e) {
                    observabilitySink.onError(new TelemetryErrorEvent(
                        wallClock.now(),
                        "Delivery to " + handle.name() + " failed",
                        e
                    ));
                }
            }
        } catch (InterruptedException e) {
            // Expected during shutdown
            if (running.get()) {
                Thread.currentThread().interrupt();
            }
        } finally {
            running.set(false);
            onFinished.run();
        }
    }
}
