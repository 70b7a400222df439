package com.questrail.telemetry.distribution;

import com.questrail.telemetry.api.ReadingBatch;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SubscriberHandle
 * -----------------------------------------------------------------------------
 * One subscriber's bounded queue and liveness state.
 *
 * <p>The hub's publishing thread is the only producer; any thread may consume
 * through {@link #poll()} or {@link #take(Duration)}. The queue lock is held
 * only for constant-time operations, so a consumer never blocks a publish for
 * longer than an enqueue.</p>
 *
 * <p>Once {@link SubscriberState#DISCONNECTED}, a handle receives nothing new;
 * batches still queued at that moment remain poppable unless they were
 * discarded by the disconnect.</p>
 */
public final class SubscriberHandle {

    /**
     * State change produced by a single offer or disconnect.
     */
    record Transition(SubscriberState oldState, SubscriberState newState, long droppedBatches) {}

    private final long id;
    private final String name;
    private final int capacity;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final ArrayDeque<DeliveredBatch> queue;

    private SubscriberState state = SubscriberState.CONNECTED;
    private long nextSequence;
    private long droppedCount;
    private int consecutiveFull;

    SubscriberHandle(long id, String name, int capacity) {
        this.id = id;
        this.name = name;
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public SubscriberState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** Batches dropped for this subscriber because its queue was full. */
    public long droppedCount() {
        lock.lock();
        try {
            return droppedCount;
        } finally {
            lock.unlock();
        }
    }

    public int queued() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest queued batch without waiting.
     */
    public Optional<DeliveredBatch> poll() {
        lock.lock();
        try {
            return Optional.ofNullable(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest queued batch, waiting up to {@code timeout} for one.
     *
     * @return empty if the timeout elapsed, or the subscriber is disconnected
     *         and its queue is empty
     */
    public Optional<DeliveredBatch> take(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (state == SubscriberState.DISCONNECTED || remaining <= 0) {
                    return Optional.empty();
                }
                remaining = changed.awaitNanos(remaining);
            }
            return Optional.of(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueues {@code batch}, dropping the oldest queued batch if full.
     *
     * @return the resulting state change, or {@code null} if the state is unchanged
     */
    Transition offer(ReadingBatch batch, int slowDisconnectThreshold) {
        lock.lock();
        try {
            if (state == SubscriberState.DISCONNECTED) {
                return null;
            }

            final SubscriberState before = state;
            final DeliveredBatch delivered = new DeliveredBatch(nextSequence++, batch);

            if (queue.size() >= capacity) {
                queue.pollFirst();
                droppedCount++;
                consecutiveFull++;
                state = consecutiveFull >= slowDisconnectThreshold
                    ? SubscriberState.DISCONNECTED
                    : SubscriberState.SLOW;
            } else {
                consecutiveFull = 0;
                state = SubscriberState.CONNECTED;
            }
            queue.addLast(delivered);
            changed.signalAll();

            return before == state ? null : new Transition(before, state, droppedCount);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the subscriber disconnected.
     *
     * @param keepQueued whether already queued batches stay poppable
     * @return the state change, or {@code null} if already disconnected
     */
    Transition disconnect(boolean keepQueued) {
        lock.lock();
        try {
            if (!keepQueued) {
                queue.clear();
            }
            if (state == SubscriberState.DISCONNECTED) {
                return null;
            }
            final SubscriberState before = state;
            state = SubscriberState.DISCONNECTED;
            changed.signalAll();
            return new Transition(before, state, droppedCount);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Subscriber[" + id + ":" + name + "]";
    }
}
