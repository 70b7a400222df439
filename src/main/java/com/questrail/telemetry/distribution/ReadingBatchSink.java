package com.questrail.telemetry.distribution;

/**
 * Destination a {@link SubscriberPump} writes delivered batches to, e.g. a
 * network client.
 *
 * <p>Called on the pump's thread only, one batch at a time.</p>
 */
@FunctionalInterface
public interface ReadingBatchSink {
    void deliver(DeliveredBatch delivered);
}
