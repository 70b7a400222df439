package com.questrail.telemetry.observability;

import com.questrail.telemetry.distribution.SubscriberState;
import com.questrail.telemetry.link.LinkException;
import com.questrail.telemetry.link.LinkState;
import com.questrail.telemetry.schema.Schema;
import com.questrail.telemetry.schema.SchemaException;
import com.questrail.telemetry.schema.TestSchemas;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The logging sink sits on the read loop, so no event shape may make it throw,
 * including events with absent causes and rejected schemas.
 */
final class Slf4jTelemetryObservabilitySinkTest {

    private static final Instant T = Instant.parse("2024-06-10T12:00:00Z");

    private final Slf4jTelemetryObservabilitySink sink = new Slf4jTelemetryObservabilitySink();

    @Test
    void logsLinkEventsWithAndWithoutCause() {
        assertDoesNotThrow(() -> {
            sink.onLinkStateTransition(new LinkStateTransitionEvent(T, LinkState.IDLE, LinkState.CONNECTING, null));
            sink.onLinkStateTransition(new LinkStateTransitionEvent(
                T, LinkState.STREAMING, LinkState.RECONNECTING, new LinkException("peer closed")));
            sink.onConnectAttemptFailed(new ConnectAttemptFailedEvent(T, 3, Duration.ofMillis(800), null));
            sink.onConnectAttemptFailed(new ConnectAttemptFailedEvent(
                T, 4, Duration.ofMillis(1600), new LinkException("refused")));
        });
    }

    @Test
    void logsSchemaEvents() {
        Schema previous = TestSchemas.engine(2);
        Schema next = TestSchemas.engine(3);
        SchemaException rejected = new SchemaException(SchemaException.Kind.DUPLICATE_ID, "rpm", "declared twice");

        assertDoesNotThrow(() -> {
            sink.onSchemaChange(new SchemaChangeEvent(T, "inline", null, next, null));
            sink.onSchemaChange(new SchemaChangeEvent(T, "inline", previous, null, rejected));
            sink.onSchemaDrift(new SchemaDriftEvent(T, 3, 2, 77L));
        });
    }

    @Test
    void logsDeliveryAndErrorEvents() {
        assertDoesNotThrow(() -> {
            sink.onFrameDropped(new FrameDroppedEvent(T, "CRC mismatch", 28));
            sink.onSubscriberStateChange(new SubscriberStateEvent(
                T, "udp:/127.0.0.1:9000", SubscriberState.CONNECTED, SubscriberState.SLOW, 1L));
            sink.onError(new TelemetryErrorEvent(T, "Emulator tick failed", new IllegalStateException("boom")));
        });
    }
}
