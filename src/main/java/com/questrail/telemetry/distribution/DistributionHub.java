package com.questrail.telemetry.distribution;

import com.questrail.telemetry.api.ReadingBatch;
import com.questrail.telemetry.config.DistributionConfig;
import com.questrail.telemetry.internal.time.WallClock;
import com.questrail.telemetry.observability.NullObservabilitySink;
import com.questrail.telemetry.observability.SubscriberStateEvent;
import com.questrail.telemetry.observability.TelemetryObservabilitySink;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * DistributionHub
 * =============================================================================
 * Fans every decoded {@link ReadingBatch} out to all current subscribers.
 *
 * <h2>Backpressure</h2>
 * Each subscriber owns a bounded queue. {@link #publish(ReadingBatch)} never
 * blocks on a subscriber: if a queue is full its oldest batch is dropped, the
 * subscriber is marked {@link SubscriberState#SLOW} and its drop counter grows.
 * A subscriber whose queue is still full after
 * {@link DistributionConfig#slowDisconnectThreshold()} consecutive publishes is
 * disconnected and removed. A publish that finds room again restores
 * {@link SubscriberState#CONNECTED}.
 *
 * <h2>Threading Model</h2>
 * The subscriber registry is guarded by a single lock; publish takes a snapshot
 * under that lock and offers outside it. Batches reach each subscriber in
 * publish order.
 */
public final class DistributionHub {

    private final DistributionConfig config;
    private final TelemetryObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final Object registryLock = new Object();
    private final Map<Long, SubscriberHandle> subscribers = new LinkedHashMap<>();
    private final AtomicLong nextId = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private boolean closed;

    public DistributionHub(DistributionConfig config,
                           TelemetryObservabilitySink observabilitySink,
                           WallClock wallClock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Registers a new subscriber with an empty queue in state CONNECTED.
     *
     * @throws IllegalStateException if the hub has been closed
     */
    public SubscriberHandle subscribe(String name) {
        Objects.requireNonNull(name, "name");
        synchronized (registryLock) {
            if (closed) {
                throw new IllegalStateException("Distribution hub is closed");
            }
            SubscriberHandle handle = new SubscriberHandle(nextId.incrementAndGet(), name, config.queueCapacity());
            subscribers.put(handle.id(), handle);
            return handle;
        }
    }

    /**
     * Offers {@code batch} to every subscriber without blocking.
     */
    public void publish(ReadingBatch batch) {
        Objects.requireNonNull(batch, "batch");

        final List<SubscriberHandle> snapshot;
        synchronized (registryLock) {
            if (closed) {
                return;
            }
            snapshot = new ArrayList<>(subscribers.values());
        }
        published.incrementAndGet();

        for (SubscriberHandle handle : snapshot) {
            SubscriberHandle.Transition t = handle.offer(batch, config.slowDisconnectThreshold());
            if (t == null) {
                continue;
            }
            if (t.newState() == SubscriberState.DISCONNECTED) {
                remove(handle);
            }
            report(handle, t);
        }
    }

    /**
     * Removes a subscriber and discards its queue. Idempotent.
     */
    public void unsubscribe(SubscriberHandle handle) {
        Objects.requireNonNull(handle, "handle");
        remove(handle);
        SubscriberHandle.Transition t = handle.disconnect(false);
        if (t != null) {
            report(handle, t);
        }
    }

    /**
     * Disconnects every subscriber and refuses new ones.
     *
     * @param drain if true, batches already queued remain poppable;
     *              otherwise they are discarded
     */
    public void close(boolean drain) {
        final List<SubscriberHandle> all;
        synchronized (registryLock) {
            if (closed) {
                return;
            }
            closed = true;
            all = new ArrayList<>(subscribers.values());
            subscribers.clear();
        }
        for (SubscriberHandle handle : all) {
            SubscriberHandle.Transition t = handle.disconnect(drain);
            if (t != null) {
                report(handle, t);
            }
        }
    }

    public DistributionConfig config() {
        return config;
    }

    public int subscriberCount() {
        synchronized (registryLock) {
            return subscribers.size();
        }
    }

    public List<SubscriberHandle> subscribers() {
        synchronized (registryLock) {
            return List.copyOf(subscribers.values());
        }
    }

    /** Batches published since construction. */
    public long publishedCount() {
        return published.get();
    }

    public boolean isClosed() {
        synchronized (registryLock) {
            return closed;
        }
    }

    private void remove(SubscriberHandle handle) {
        synchronized (registryLock) {
            subscribers.remove(handle.id());
        }
    }

    private void report(SubscriberHandle handle, SubscriberHandle.Transition t) {
        observabilitySink.onSubscriberStateChange(new SubscriberStateEvent(
            wallClock.now(),
            handle.name(),
            t.oldState(),
            t.newState(),
            t.droppedBatches()
        ));
    }
}
