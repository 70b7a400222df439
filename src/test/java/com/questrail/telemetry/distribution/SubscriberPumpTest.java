package com.questrail.telemetry.distribution;

import com.questrail.telemetry.config.DistributionConfig;
import com.questrail.telemetry.observability.RecordingObservabilitySink;
import com.questrail.telemetry.observability.TelemetryErrorEvent;
import com.questrail.telemetry.time.FixedWallClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class SubscriberPumpTest {

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FixedWallClock wallClock = new FixedWallClock();
    private final DistributionHub hub = new DistributionHub(new DistributionConfig(64, 8), sink, wallClock);

    private SubscriberPump pump;

    @AfterEach
    void tearDown() {
        if (pump != null) {
            pump.stop();
        }
    }

    @Test
    void deliversBatchesInOrder() throws Exception {
        List<Long> delivered = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(5);
        pump = new SubscriberPump(hub.subscribe("display"), d -> {
            delivered.add(d.batch().frameSequence());
            done.countDown();
        }, sink, wallClock);
        pump.start();

        for (long i = 0; i < 5; i++) {
            hub.publish(TestBatches.batch(i));
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(0L, 1L, 2L, 3L, 4L), delivered);
        assertEquals(5, pump.deliveredCount());
    }

    @Test
    void sinkFailureIsReportedAndPumpContinues() throws Exception {
        CountDownLatch second = new CountDownLatch(1);
        pump = new SubscriberPump(hub.subscribe("flaky"), d -> {
            if (d.sequence() == 0) {
                throw new IllegalStateException("socket closed");
            }
            second.countDown();
        }, sink, wallClock);
        pump.start();

        hub.publish(TestBatches.batch(0));
        hub.publish(TestBatches.batch(1));

        assertTrue(second.await(5, TimeUnit.SECONDS));
        List<String> errors = sink.eventsOfType(TelemetryErrorEvent.class).stream()
            .map(TelemetryErrorEvent::message)
            .collect(Collectors.toList());
        assertEquals(List.of("Delivery to flaky failed"), errors);
        assertTrue(pump.isRunning());
    }

    @Test
    void pumpExitsOnceSubscriberIsGoneAndDrained() throws Exception {
        List<Long> delivered = new CopyOnWriteArrayList<>();
        SubscriberHandle handle = hub.subscribe("draining");
        hub.publish(TestBatches.batch(0));
        hub.publish(TestBatches.batch(1));
        hub.close(true);

        pump = new SubscriberPump(handle, d -> delivered.add(d.batch().frameSequence()), sink, wallClock);
        pump.start();
        pump.awaitTermination(Duration.ofSeconds(5));

        assertFalse(pump.isRunning());
        assertEquals(List.of(0L, 1L), delivered);
    }

    @Test
    void stopInterruptsIdlePump() {
        pump = new SubscriberPump(hub.subscribe("idle"), d -> {}, sink, wallClock);
        pump.start();
        assertTrue(pump.isRunning());

        pump.stop();

        assertFalse(pump.isRunning());
    }
}
