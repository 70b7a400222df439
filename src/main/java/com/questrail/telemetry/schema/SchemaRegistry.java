package com.questrail.telemetry.schema;

import com.questrail.telemetry.internal.time.SystemWallClock;
import com.questrail.telemetry.internal.time.WallClock;
import com.questrail.telemetry.observability.NullObservabilitySink;
import com.questrail.telemetry.observability.SchemaChangeEvent;
import com.questrail.telemetry.observability.TelemetryObservabilitySink;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SchemaRegistry
 * -----------------------------------------------------------------------------
 * Holds the active {@link Schema} and replaces it atomically on reload.
 *
 * <p>Readers call {@link #current()} without locking and keep the returned
 * instance for the duration of one frame. Writers are serialized, so two
 * concurrent reloads cannot interleave their outcome reports.</p>
 *
 * <p>A reload that fails validation leaves the previous schema active; the
 * rejection is reported to the observability sink and rethrown to the caller.</p>
 */
public final class SchemaRegistry {
    private final AtomicReference<Schema> active = new AtomicReference<>();
    private final SchemaLoader loader;
    private final TelemetryObservabilitySink sink;
    private final WallClock wallClock;

    public SchemaRegistry() {
        this(new SchemaLoader(), NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    public SchemaRegistry(SchemaLoader loader, TelemetryObservabilitySink sink, WallClock wallClock) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Returns the active schema.
     *
     * @throws IllegalStateException if no schema has been loaded yet
     */
    public Schema current() {
        Schema schema = active.get();
        if (schema == null) {
            throw new IllegalStateException("No schema loaded");
        }
        return schema;
    }

    public Optional<Schema> currentIfLoaded() {
        return Optional.ofNullable(active.get());
    }

    /**
     * Loads {@code source} and, if it validates, makes it the active schema.
     *
     * @return the newly active schema
     * @throws SchemaException if loading fails; the previous schema stays active
     */
    public synchronized Schema reload(SchemaSource source) throws SchemaException {
        Objects.requireNonNull(source, "source");
        Schema previous = active.get();
        Schema loaded;
        try {
            loaded = loader.load(source);
        } catch (SchemaException e) {
            sink.onSchemaChange(new SchemaChangeEvent(
                wallClock.now(), source.description(), previous, null, e));
            throw e;
        }
        active.set(loaded);
        sink.onSchemaChange(new SchemaChangeEvent(
            wallClock.now(), source.description(), previous, loaded, null));
        return loaded;
    }

    /**
     * Makes an already validated schema the active one.
     */
    public synchronized void install(Schema schema) {
        Objects.requireNonNull(schema, "schema");
        Schema previous = active.getAndSet(schema);
        sink.onSchemaChange(new SchemaChangeEvent(
            wallClock.now(), "programmatic", previous, schema, null));
    }
}
