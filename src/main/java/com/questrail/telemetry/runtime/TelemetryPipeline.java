package com.questrail.telemetry.runtime;

import com.questrail.telemetry.api.ReadingBatch;
import com.questrail.telemetry.codec.FrameIntegrityException;
import com.questrail.telemetry.codec.TelemetryFrameDecoder;
import com.questrail.telemetry.codec.frame.TelemetryFrame;
import com.questrail.telemetry.distribution.DistributionHub;
import com.questrail.telemetry.internal.time.WallClock;
import com.questrail.telemetry.link.StreamFramer;
import com.questrail.telemetry.observability.FrameDroppedEvent;
import com.questrail.telemetry.observability.NullObservabilitySink;
import com.questrail.telemetry.observability.SchemaDriftEvent;
import com.questrail.telemetry.observability.TelemetryObservabilitySink;
import com.questrail.telemetry.schema.Schema;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * TelemetryPipeline
 * =============================================================================
 * Frame → decode → publish, invoked synchronously for every frame the link
 * supervisor extracts.
 *
 * <h2>Inbound Data Flow</h2>
 * <pre>
 *   StreamFramer
 *        → TelemetryPipeline.accept(frame)
 *            → TelemetryFrameDecoder (schema captured once per frame)
 *                → DistributionHub.publish(batch)
 * </pre>
 *
 * <p>Wire-level failures are absorbed here: a frame that fails integrity
 * checks is counted, reported and dropped, and never reaches subscribers.
 * A frame whose schema version differs from the active schema is reported as
 * drift but still decoded with the active schema.</p>
 *
 * <p>Also acts as the framer's {@link StreamFramer.DiscardListener}, so bytes
 * lost to resynchronization show up in the same statistics.</p>
 */
public final class TelemetryPipeline implements Consumer<TelemetryFrame>, StreamFramer.DiscardListener {

    private final Supplier<Schema> schemaSupplier;
    private final TelemetryFrameDecoder decoder;
    private final DistributionHub hub;
    private final TelemetryObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final AtomicLong framesReceived = new AtomicLong();
    private final AtomicLong framesDecoded = new AtomicLong();
    private final AtomicLong framesDropped = new AtomicLong();
    private final AtomicLong bytesDiscarded = new AtomicLong();
    private final AtomicLong schemaVersionMismatches = new AtomicLong();
    private final AtomicLong partialFrames = new AtomicLong();
    private final AtomicLong invalidReadings = new AtomicLong();
    private final AtomicLong batchesPublished = new AtomicLong();

    public TelemetryPipeline(Supplier<Schema> schemaSupplier,
                             TelemetryFrameDecoder decoder,
                             DistributionHub hub,
                             TelemetryObservabilitySink observabilitySink,
                             WallClock wallClock)
    {
        this.schemaSupplier = Objects.requireNonNull(schemaSupplier, "schemaSupplier");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.hub = Objects.requireNonNull(hub, "hub");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void accept(TelemetryFrame frame) {
        framesReceived.incrementAndGet();

        // One schema per frame, even if a reload lands mid-decode.
        final Schema schema = schemaSupplier.get();

        final ReadingBatch batch;
        try {
            batch = decoder.decode(frame, schema);
        } catch (FrameIntegrityException e) {
            framesDropped.incrementAndGet();
            observabilitySink.onFrameDropped(new FrameDroppedEvent(
                wallClock.now(),
                e.reason() + ": " + e.getMessage(),
                frame.length()
            ));
            return;
        }
        framesDecoded.incrementAndGet();

        if (batch.schemaVersion() != schema.version()) {
            schemaVersionMismatches.incrementAndGet();
            observabilitySink.onSchemaDrift(new SchemaDriftEvent(
                wallClock.now(),
                schema.version(),
                batch.schemaVersion(),
                batch.frameSequence()
            ));
        }
        if (!batch.complete()) {
            partialFrames.incrementAndGet();
        }
        invalidReadings.addAndGet(batch.invalidCount());

        hub.publish(batch);
        batchesPublished.incrementAndGet();
    }

    @Override
    public void onDiscarded(int byteCount, String reason) {
        bytesDiscarded.addAndGet(byteCount);
        observabilitySink.onFrameDropped(new FrameDroppedEvent(wallClock.now(), reason, byteCount));
    }

    public PipelineStatistics statistics() {
        return new PipelineStatistics(
            framesReceived.get(),
            framesDecoded.get(),
            framesDropped.get(),
            bytesDiscarded.get(),
            schemaVersionMismatches.get(),
            partialFrames.get(),
            invalidReadings.get(),
            batchesPublished.get()
        );
    }
}
