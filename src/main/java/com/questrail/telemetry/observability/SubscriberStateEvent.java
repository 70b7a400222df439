package com.questrail.telemetry.observability;

import com.questrail.telemetry.distribution.SubscriberState;

import java.time.Instant;

/**
 * Record representing a liveness change of one subscriber.
 *
 * @param droppedBatches total batches dropped for this subscriber so far
 */
public record SubscriberStateEvent(
    Instant timestamp,
    String subscriber,
    SubscriberState oldState,
    SubscriberState newState,
    long droppedBatches
) {
}
