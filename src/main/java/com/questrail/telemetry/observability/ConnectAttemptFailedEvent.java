package com.questrail.telemetry.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing one failed attempt to open the telemetry link.
 *
 * @param attempt   1-based count of consecutive failed attempts
 * @param nextDelay backoff applied before the next attempt
 */
public record ConnectAttemptFailedEvent(
    Instant timestamp,
    int attempt,
    Duration nextDelay,
    Throwable cause
) {
}
