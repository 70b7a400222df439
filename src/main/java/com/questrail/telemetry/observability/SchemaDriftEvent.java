package com.questrail.telemetry.observability;

import java.time.Instant;

/**
 * Record representing a frame whose schema version differs from the active schema.
 */
public record SchemaDriftEvent(
    Instant timestamp,
    int activeVersion,
    int frameVersion,
    long frameSequence
) {
}
