package com.questrail.telemetry.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the relay.
 */
public record TelemetryErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
