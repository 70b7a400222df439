package com.questrail.telemetry.distribution;

import com.questrail.telemetry.api.ReadingBatch;

import java.util.Objects;

/**
 * A batch as seen by one subscriber.
 *
 * @param sequence per-subscriber delivery sequence; increments by one for every
 *                 batch published to this subscriber, so a jump reveals batches
 *                 dropped by backpressure
 * @param batch    the published batch
 */
public record DeliveredBatch(long sequence, ReadingBatch batch) {
    public DeliveredBatch {
        Objects.requireNonNull(batch, "batch");
    }
}
