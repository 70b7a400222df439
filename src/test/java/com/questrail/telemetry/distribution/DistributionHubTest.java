package com.questrail.telemetry.distribution;

import com.questrail.telemetry.config.DistributionConfig;
import com.questrail.telemetry.observability.RecordingObservabilitySink;
import com.questrail.telemetry.observability.SubscriberStateEvent;
import com.questrail.telemetry.time.FixedWallClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class DistributionHubTest {

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private DistributionHub hub(int capacity, int threshold) {
        return new DistributionHub(new DistributionConfig(capacity, threshold), sink, new FixedWallClock());
    }

    private static List<Long> drain(SubscriberHandle handle) {
        List<Long> frameSequences = new ArrayList<>();
        while (true) {
            Optional<DeliveredBatch> next = handle.poll();
            if (next.isEmpty()) {
                return frameSequences;
            }
            frameSequences.add(next.get().batch().frameSequence());
        }
    }

    private List<String> stateChanges() {
        return sink.eventsOfType(SubscriberStateEvent.class).stream()
            .map(e -> e.subscriber() + ":" + e.oldState() + "->" + e.newState())
            .collect(Collectors.toList());
    }

    @Test
    void everySubscriberReceivesEveryBatchInOrder() {
        DistributionHub hub = hub(16, 4);
        SubscriberHandle a = hub.subscribe("a");
        SubscriberHandle b = hub.subscribe("b");

        for (long i = 0; i < 5; i++) {
            hub.publish(TestBatches.batch(i));
        }

        assertEquals(List.of(0L, 1L, 2L, 3L, 4L), drain(a));
        assertEquals(List.of(0L, 1L, 2L, 3L, 4L), drain(b));
        assertEquals(5, hub.publishedCount());
        assertTrue(stateChanges().isEmpty());
    }

    @Test
    void lateSubscriberSeesOnlyLaterBatches() {
        DistributionHub hub = hub(16, 4);
        hub.publish(TestBatches.batch(0));
        SubscriberHandle late = hub.subscribe("late");
        hub.publish(TestBatches.batch(1));

        DeliveredBatch only = late.poll().orElseThrow();
        assertEquals(0, only.sequence());
        assertEquals(1, only.batch().frameSequence());
    }

    @Test
    void fullQueueDropsOldestAndRevealsGap() {
        DistributionHub hub = hub(4, 100);
        SubscriberHandle slow = hub.subscribe("slow");

        for (long i = 0; i < 10; i++) {
            hub.publish(TestBatches.batch(i));
        }

        assertEquals(4, slow.queued());
        assertEquals(6, slow.droppedCount());
        assertEquals(SubscriberState.SLOW, slow.state());

        List<Long> sequences = new ArrayList<>();
        slow.poll().ifPresent(d -> sequences.add(d.sequence()));
        slow.poll().ifPresent(d -> sequences.add(d.sequence()));
        assertEquals(List.of(6L, 7L), sequences);
        assertEquals(List.of("slow:CONNECTED->SLOW"), stateChanges());
    }

    @Test
    void persistentlySlowSubscriberIsDisconnected() {
        DistributionHub hub = hub(2, 3);
        SubscriberHandle slow = hub.subscribe("slow");
        SubscriberHandle fast = hub.subscribe("fast");
        List<Long> fastSeen = new ArrayList<>();

        for (long i = 0; i < 8; i++) {
            hub.publish(TestBatches.batch(i));
            fastSeen.addAll(drain(fast));
        }

        assertEquals(SubscriberState.DISCONNECTED, slow.state());
        assertEquals(List.of(fast), hub.subscribers());
        assertEquals(3, slow.droppedCount());
        assertEquals(List.of(3L, 4L), drain(slow));

        assertEquals(List.of(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L), fastSeen);
        assertEquals(SubscriberState.CONNECTED, fast.state());
        assertEquals(List.of("slow:CONNECTED->SLOW", "slow:SLOW->DISCONNECTED"), stateChanges());

        SubscriberStateEvent last = sink.eventsOfType(SubscriberStateEvent.class).get(1);
        assertEquals(3, last.droppedBatches());
    }

    @Test
    void slowSubscriberRecoversWhenItCatchesUp() {
        DistributionHub hub = hub(2, 10);
        SubscriberHandle sub = hub.subscribe("sub");

        for (long i = 0; i < 3; i++) {
            hub.publish(TestBatches.batch(i));
        }
        assertEquals(SubscriberState.SLOW, sub.state());

        drain(sub);
        hub.publish(TestBatches.batch(3));

        assertEquals(SubscriberState.CONNECTED, sub.state());
        assertEquals(List.of("sub:CONNECTED->SLOW", "sub:SLOW->CONNECTED"), stateChanges());
    }

    @Test
    void unsubscribeIsIdempotentAndDiscardsQueue() throws Exception {
        DistributionHub hub = hub(8, 4);
        SubscriberHandle sub = hub.subscribe("sub");
        hub.publish(TestBatches.batch(0));

        hub.unsubscribe(sub);
        hub.unsubscribe(sub);

        assertEquals(0, hub.subscriberCount());
        assertEquals(SubscriberState.DISCONNECTED, sub.state());
        assertTrue(sub.take(Duration.ofSeconds(5)).isEmpty());
        assertEquals(1, stateChanges().size());

        hub.publish(TestBatches.batch(1));
        assertEquals(0, sub.queued());
    }

    @Test
    void drainingCloseKeepsQueuedBatches() {
        DistributionHub hub = hub(8, 4);
        SubscriberHandle sub = hub.subscribe("sub");
        hub.publish(TestBatches.batch(0));
        hub.publish(TestBatches.batch(1));

        hub.close(true);

        assertTrue(hub.isClosed());
        assertEquals(SubscriberState.DISCONNECTED, sub.state());
        assertEquals(List.of(0L, 1L), drain(sub));

        hub.publish(TestBatches.batch(2));
        assertEquals(2, hub.publishedCount());
        assertThrows(IllegalStateException.class, () -> hub.subscribe("another"));
    }

    @Test
    void nonDrainingCloseDiscardsQueuedBatches() {
        DistributionHub hub = hub(8, 4);
        SubscriberHandle sub = hub.subscribe("sub");
        hub.publish(TestBatches.batch(0));

        hub.close(false);

        assertEquals(0, sub.queued());
        assertTrue(drain(sub).isEmpty());
    }

    @Test
    void takeWaitsForPublish() throws Exception {
        DistributionHub hub = hub(8, 4);
        SubscriberHandle sub = hub.subscribe("sub");

        assertTrue(sub.take(Duration.ofMillis(10)).isEmpty());

        Thread publisher = new Thread(() -> hub.publish(TestBatches.batch(42)));
        publisher.start();
        DeliveredBatch got = sub.take(Duration.ofSeconds(5)).orElseThrow();
        publisher.join();

        assertEquals(42, got.batch().frameSequence());
    }

    @Test
    void concurrentConsumerSeesPublishOrder() throws Exception {
        DistributionHub hub = hub(2048, 4);
        SubscriberHandle sub = hub.subscribe("sub");
        List<Long> seen = new ArrayList<>();

        Thread consumer = new Thread(() -> {
            try {
                while (seen.size() < 1000) {
                    sub.take(Duration.ofSeconds(5)).ifPresent(d -> seen.add(d.batch().frameSequence()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();
        for (long i = 0; i < 1000; i++) {
            hub.publish(TestBatches.batch(i));
        }
        consumer.join(10_000);

        assertEquals(1000, seen.size());
        for (int i = 0; i < seen.size(); i++) {
            assertEquals((long) i, seen.get(i).longValue());
        }
    }
}
