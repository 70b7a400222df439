package com.questrail.telemetry.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Reading
 * -----------------------------------------------------------------------------
 * One decoded sensor value.
 *
 * <p>A reading is forwarded to clients even when it is not {@code valid}; the
 * flag tells the client that the value fell outside the sensor's declared
 * {@code [min, max]} range or could not be decoded at all (truncated frame).
 * Readings that could not be decoded carry {@link Double#NaN} as their value.</p>
 *
 * @param sensorId  schema id of the sensor
 * @param value     decoded, scaled engineering value
 * @param timestamp time carried by the frame this reading was decoded from
 * @param valid     {@code false} if the value is out of range or missing
 */
public record Reading(
        String sensorId,
        double value,
        Instant timestamp,
        boolean valid
) {
    public Reading {
        Objects.requireNonNull(sensorId, "sensorId");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Reading for a sensor whose bytes did not fit in the received frame.
     */
    public static Reading missing(String sensorId, Instant timestamp) {
        return new Reading(sensorId, Double.NaN, timestamp, false);
    }
}
