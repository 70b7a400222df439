package com.questrail.telemetry.api;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ReadingBatch
 * -----------------------------------------------------------------------------
 * Ordered readings decoded from exactly one telemetry frame.
 *
 * <p>A batch is the unit of delivery: subscribers receive whole batches or
 * nothing. Readings appear in schema declaration order.</p>
 *
 * @param frameSequence sequence number carried by the source frame
 * @param schemaVersion schema version carried by the source frame
 * @param timestamp     timestamp carried by the source frame
 * @param readings      decoded readings, never null
 * @param complete      {@code false} if the source frame was truncated
 */
public record ReadingBatch(
        long frameSequence,
        int schemaVersion,
        Instant timestamp,
        List<Reading> readings,
        boolean complete
) {
    public ReadingBatch {
        Objects.requireNonNull(timestamp, "timestamp");
        readings = List.copyOf(Objects.requireNonNull(readings, "readings"));
    }

    /**
     * Returns the reading for {@code sensorId}, if this batch carries one.
     */
    public Optional<Reading> reading(String sensorId) {
        Objects.requireNonNull(sensorId, "sensorId");
        for (Reading r : readings) {
            if (r.sensorId().equals(sensorId)) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return readings.size();
    }

    public long invalidCount() {
        return readings.stream().filter(r -> !r.valid()).count();
    }
}
