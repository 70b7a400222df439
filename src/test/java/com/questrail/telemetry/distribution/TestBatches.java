package com.questrail.telemetry.distribution;

import com.questrail.telemetry.api.Reading;
import com.questrail.telemetry.api.ReadingBatch;

import java.time.Instant;
import java.util.List;

/**
 * Minimal batches for hub and transport tests.
 */
public final class TestBatches {

    public static final Instant T0 = Instant.ofEpochMilli(1_718_000_000_123L);

    private TestBatches() {}

    /**
     * One valid rpm reading whose value equals {@code frameSequence}.
     */
    public static ReadingBatch batch(long frameSequence) {
        return new ReadingBatch(frameSequence, 3, T0,
            List.of(new Reading("rpm", frameSequence, T0, true)), true);
    }
}
