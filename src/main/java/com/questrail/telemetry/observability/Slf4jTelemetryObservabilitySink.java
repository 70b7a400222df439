package com.questrail.telemetry.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TelemetryObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTelemetryObservabilitySink implements TelemetryObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTelemetryObservabilitySink.class);

    @Override
    public void onLinkStateTransition(LinkStateTransitionEvent event) {
        if (event.cause() != null) {
            log.warn("Telemetry link: {} -> {} ({})",
                event.oldState(),
                event.newState(),
                event.cause().toString());
        } else {
            log.info("Telemetry link: {} -> {}", event.oldState(), event.newState());
        }
    }

    @Override
    public void onConnectAttemptFailed(ConnectAttemptFailedEvent event) {
        log.warn("Link connect attempt {} failed, retrying in {} ms: {}",
            event.attempt(),
            event.nextDelay().toMillis(),
            event.cause() != null ? event.cause().getMessage() : "unknown");
    }

    @Override
    public void onFrameDropped(FrameDroppedEvent event) {
        log.debug("Dropped {} bytes: {}", event.byteCount(), event.reason());
    }

    @Override
    public void onSchemaChange(SchemaChangeEvent event) {
        if (event.applied()) {
            log.info("Schema from {} applied: {} (previous {})",
                event.source(), event.schema(), event.previous());
        } else {
            log.error("Schema from {} rejected, keeping {}: {}",
                event.source(), event.previous(), event.error().getMessage());
        }
    }

    @Override
    public void onSchemaDrift(SchemaDriftEvent event) {
        log.warn("Frame {} carries schema version {} but version {} is active",
            event.frameSequence(), event.frameVersion(), event.activeVersion());
    }

    @Override
    public void onSubscriberStateChange(SubscriberStateEvent event) {
        log.info("Subscriber {}: {} -> {} ({} batches dropped)",
            event.subscriber(), event.oldState(), event.newState(), event.droppedBatches());
    }

    @Override
    public void onError(TelemetryErrorEvent event) {
        log.error("Telemetry error: {}", event.message(), event.cause());
    }
}
