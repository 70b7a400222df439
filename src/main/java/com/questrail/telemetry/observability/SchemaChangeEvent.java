package com.questrail.telemetry.observability;

import com.questrail.telemetry.schema.Schema;
import com.questrail.telemetry.schema.SchemaException;

import java.time.Instant;

/**
 * Record representing the outcome of a schema load or reload.
 *
 * <p>Exactly one of {@code schema} (applied) and {@code error} (rejected) is
 * non-null.</p>
 */
public record SchemaChangeEvent(
    Instant timestamp,
    String source,
    Schema previous,
    Schema schema,
    SchemaException error
) {
    public boolean applied() {
        return error == null;
    }
}
