package com.questrail.telemetry.link;

import com.questrail.telemetry.codec.frame.TelemetryFrame;
import com.questrail.telemetry.codec.impl.DefaultTelemetryFrameEncoder;
import com.questrail.telemetry.internal.time.SystemMonotonicClock;
import com.questrail.telemetry.internal.time.SystemSleeper;
import com.questrail.telemetry.observability.ConnectAttemptFailedEvent;
import com.questrail.telemetry.observability.LinkStateTransitionEvent;
import com.questrail.telemetry.observability.RecordingObservabilitySink;
import com.questrail.telemetry.observability.TelemetryErrorEvent;
import com.questrail.telemetry.schema.Schema;
import com.questrail.telemetry.schema.TestSchemas;
import com.questrail.telemetry.time.FixedWallClock;
import com.questrail.telemetry.time.ManualMonotonicClock;
import com.questrail.telemetry.time.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LinkSupervisorTest
 * -----------------------------------------------------------------------------
 * Drives the supervision loop on the test thread with a manual clock and a
 * recording sleeper, so backoff and stall timing are asserted exactly.
 */
final class LinkSupervisorTest {

    private static final Instant T0 = Instant.ofEpochMilli(1_718_000_000_123L);

    private final Schema schema = TestSchemas.engine();
    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final RecordingSleeper sleeper = new RecordingSleeper(clock);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final List<TelemetryFrame> received = Collections.synchronizedList(new ArrayList<>());
    private final ScriptedLinkConnector connector = new ScriptedLinkConnector();

    private LinkSupervisor supervisor;

    @BeforeEach
    void setUp() {
        supervisor = supervisor(connector, received::add);
        connector.whenExhausted(supervisor::stop);
    }

    @AfterEach
    void tearDown() {
        supervisor.stop();
    }

    private LinkSupervisor supervisor(LinkConnector linkConnector, Consumer<TelemetryFrame> consumer) {
        StreamFramer framer = new StreamFramer(schema::startByte, schema::fullPayloadLength, (n, reason) -> {});
        return new LinkSupervisor(
            linkConnector,
            framer,
            consumer,
            LinkTimingPolicy.defaults(),
            clock,
            sleeper,
            new FixedWallClock(),
            sink
        );
    }

    private byte[] frameBytes(long sequence) {
        return new DefaultTelemetryFrameEncoder().encode(Map.of("rpm", 1000.0), schema, sequence, T0).bytes();
    }

    private List<String> transitions() {
        return sink.eventsOfType(LinkStateTransitionEvent.class).stream()
            .map(e -> e.oldState() + "->" + e.newState())
            .collect(Collectors.toList());
    }

    @Test
    void failedConnectsBackOffGeometrically() {
        connector.refuse("refused").refuse("refused").refuse("refused");

        supervisor.run();

        assertEquals(List.of(
            Duration.ofMillis(250), Duration.ofMillis(500), Duration.ofMillis(1000), Duration.ofMillis(2000)),
            sleeper.sleeps());
        assertEquals(4, supervisor.connectFailures());
        assertEquals(List.of(1, 2, 3, 4), sink.eventsOfType(ConnectAttemptFailedEvent.class).stream()
            .map(ConnectAttemptFailedEvent::attempt).collect(Collectors.toList()));
        assertEquals(List.of("IDLE->CONNECTING", "CONNECTING->STOPPED"), transitions());
        assertEquals(LinkState.STOPPED, supervisor.state());
    }

    @Test
    void successfulConnectResetsBackoff() {
        ScriptedByteStreamSource source = new ScriptedByteStreamSource(clock);
        connector.refuse("refused").refuse("refused").accept(source).refuse("refused");

        supervisor.run();

        assertEquals(List.of(
            Duration.ofMillis(250), Duration.ofMillis(500), Duration.ofMillis(250), Duration.ofMillis(500)),
            sleeper.sleeps());
        assertEquals(1, supervisor.linkDrops());
        assertTrue(source.isClosed());
    }

    @Test
    void uncheckedConnectorFailureIsRetriedLikeARefusal() {
        ScriptedByteStreamSource source = new ScriptedByteStreamSource(clock).data(frameBytes(9));
        connector
            .crash(new UncheckedIOException("serial port busy", new IOException("EBUSY")))
            .crash(new IllegalStateException("driver not ready"))
            .accept(source);

        supervisor.run();

        assertEquals(List.of(new TelemetryFrame(frameBytes(9))), received);
        assertEquals(4, connector.attempts());
        assertEquals(3, supervisor.connectFailures());
        assertEquals(List.of(Duration.ofMillis(250), Duration.ofMillis(500), Duration.ofMillis(250)),
            sleeper.sleeps());
        assertEquals(2, sink.eventsOfType(TelemetryErrorEvent.class).size());
        assertTrue(source.isClosed());
        assertEquals(LinkState.STOPPED, supervisor.state());
    }

    @Test
    void streamsFramesAndReconnectsAtEndOfStream() {
        byte[] first = frameBytes(1);
        byte[] second = frameBytes(2);
        ScriptedByteStreamSource source = new ScriptedByteStreamSource(clock)
            .data(Arrays.copyOfRange(first, 0, 7))
            .data(Arrays.copyOfRange(first, 7, first.length))
            .data(second);
        connector.accept(source);

        supervisor.run();

        assertEquals(List.of(new TelemetryFrame(first), new TelemetryFrame(second)), received);
        assertEquals(List.of(
            "IDLE->CONNECTING",
            "CONNECTING->STREAMING",
            "STREAMING->RECONNECTING",
            "RECONNECTING->CONNECTING",
            "CONNECTING->STOPPED"), transitions());
        assertTrue(source.isClosed());
        assertEquals(1, supervisor.linkDrops());
        assertEquals(2, connector.attempts());
    }

    @Test
    void silentLinkIsDroppedAfterStallTimeout() {
        // 15 reads of 200 ms reach the 3 s stall timeout.
        ScriptedByteStreamSource source = new ScriptedByteStreamSource(clock)
            .data(frameBytes(1))
            .silence(15)
            .data(frameBytes(2));
        connector.accept(source);

        supervisor.run();

        assertEquals(1, received.size());
        LinkStateTransitionEvent drop = sink.eventsOfType(LinkStateTransitionEvent.class).get(2);
        assertEquals(LinkState.RECONNECTING, drop.newState());
        assertTrue(drop.cause().getMessage().contains("No data"));
        assertTrue(source.isClosed());
    }

    @Test
    void readFailureTriggersReconnect() {
        ScriptedByteStreamSource source = new ScriptedByteStreamSource(clock).failure("connection reset");
        connector.accept(source);

        supervisor.run();

        LinkStateTransitionEvent drop = sink.eventsOfType(LinkStateTransitionEvent.class).get(2);
        assertEquals(LinkState.RECONNECTING, drop.newState());
        assertEquals("connection reset", drop.cause().getMessage());
    }

    @Test
    void consumerFailureIsReportedAndLinkIsReopened() {
        ScriptedLinkConnector failing = new ScriptedLinkConnector()
            .accept(new ScriptedByteStreamSource(clock).data(frameBytes(1)));
        LinkSupervisor s = supervisor(failing, frame -> {
            throw new IllegalStateException("boom");
        });
        failing.whenExhausted(s::stop);

        s.run();

        assertTrue(sink.hasEventOfType(TelemetryErrorEvent.class));
        assertEquals(1, s.linkDrops());
        assertEquals(LinkState.STOPPED, s.state());
    }

    @Test
    void stopBeforeStartIsTerminal() {
        supervisor.stop();
        assertEquals(LinkState.STOPPED, supervisor.state());

        supervisor.run();
        assertEquals(0, connector.attempts());
    }

    @Test
    void stopReleasesLinkHeldByRunningThread() throws Exception {
        BlockingSource source = new BlockingSource();
        ScriptedLinkConnector live = new ScriptedLinkConnector().accept(source);
        StreamFramer framer = new StreamFramer(schema::startByte, schema::fullPayloadLength, (n, reason) -> {});
        LinkSupervisor threaded = new LinkSupervisor(
            live, framer, received::add,
            new LinkTimingPolicy(Duration.ofSeconds(1), Duration.ofMillis(50), Duration.ofSeconds(30),
                Duration.ofMillis(10), Duration.ofMillis(100), 2.0),
            SystemMonotonicClock.INSTANCE, SystemSleeper.INSTANCE, new FixedWallClock(), sink);

        threaded.start();
        assertTrue(source.opened.await(5, TimeUnit.SECONDS));

        threaded.stop();

        assertEquals(LinkState.STOPPED, threaded.state());
        assertTrue(source.closed.await(1, TimeUnit.SECONDS));
    }

    /**
     * Source that never delivers data until closed.
     */
    private static final class BlockingSource implements ByteStreamSource {
        final CountDownLatch opened = new CountDownLatch(1);
        final CountDownLatch closed = new CountDownLatch(1);

        @Override
        public int read(byte[] buf, Duration timeout) throws InterruptedException {
            opened.countDown();
            return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS) ? -1 : 0;
        }

        @Override
        public void close() {
            closed.countDown();
        }
    }
}
