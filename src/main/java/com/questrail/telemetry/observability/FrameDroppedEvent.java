package com.questrail.telemetry.observability;

import java.time.Instant;

/**
 * Record representing a frame (or a run of unframeable bytes) that was
 * discarded before reaching subscribers.
 *
 * @param reason     short diagnostic, e.g. "CRC mismatch"
 * @param byteCount  number of bytes discarded
 */
public record FrameDroppedEvent(
    Instant timestamp,
    String reason,
    int byteCount
) {
}
