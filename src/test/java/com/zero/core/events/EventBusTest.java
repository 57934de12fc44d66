package com.zero.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static ZeroEvent event(String type, String jobId) {
        return ZeroEvent.of(type, jobId, null, Map.of(), Instant.now());
    }

    // -- ZeroEvent record tests -----------------------------------------------

    @Nested
    @DisplayName("ZeroEvent")
    class ZeroEventTests {

        @Test
        @DisplayName("copies the payload")
        void copiesPayload() {
            var payload = new HashMap<String, Object>();
            payload.put("wave", 1);
            var event = ZeroEvent.of("wave.started", "SCAN-2026-0001", null, payload, Instant.now());
            payload.put("wave", 2);

            assertEquals(1, event.payload().get("wave"));
            assertThrows(UnsupportedOperationException.class, () -> event.payload().put("x", 1));
        }

        @Test
        @DisplayName("null payload becomes empty")
        void nullPayload() {
            var event = ZeroEvent.of("job.queued", "SCAN-2026-0001", null, null, Instant.now());
            assertTrue(event.payload().isEmpty());
            assertNull(event.analyzerId());
        }

        @Test
        @DisplayName("only job completion events are terminal")
        void terminalEvents() {
            assertTrue(event("job.completed", "J").isTerminal());
            assertTrue(event("job.failed", "J").isTerminal());
            assertTrue(event("job.cancelled", "J").isTerminal());
            assertFalse(event("analyzer.failed", "J").isTerminal());
            assertFalse(event("wave.completed", "J").isTerminal());
        }
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers events to the job's subscribers in order")
        void deliversInOrder() {
            List<ZeroEvent> received = new ArrayList<>();
            eventBus.subscribe("SCAN-2026-0001", received::add);

            eventBus.publish(event("job.started", "SCAN-2026-0001"));
            eventBus.publish(event("wave.started", "SCAN-2026-0001"));
            eventBus.publish(event("job.completed", "SCAN-2026-0001"));

            assertEquals(List.of("job.started", "wave.started", "job.completed"),
                    received.stream().map(ZeroEvent::eventType).toList());
        }

        @Test
        @DisplayName("does not deliver events of other jobs")
        void otherJobsIgnored() {
            List<ZeroEvent> received = new ArrayList<>();
            eventBus.subscribe("SCAN-2026-0002", received::add);

            eventBus.publish(event("job.started", "SCAN-2026-0001"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global and job subscribers both receive the event")
        void globalAndJobSubscribers() {
            List<ZeroEvent> global = new ArrayList<>();
            List<ZeroEvent> job = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe("SCAN-2026-0001", job::add);

            eventBus.publish(event("job.started", "SCAN-2026-0001"));
            eventBus.publish(event("job.started", "SCAN-2026-0002"));

            assertEquals(2, global.size());
            assertEquals(1, job.size());
        }
    }

    // -- Unsubscribe tests ----------------------------------------------------

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery and drops the empty job entry")
        void unsubscribe() {
            List<ZeroEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("SCAN-2026-0001", received::add);
            assertEquals(1, eventBus.subscriberCount("SCAN-2026-0001"));

            subscription.unsubscribe();
            eventBus.publish(event("job.started", "SCAN-2026-0001"));

            assertTrue(received.isEmpty());
            assertEquals(0, eventBus.subscriberCount("SCAN-2026-0001"));
        }

        @Test
        @DisplayName("unsubscribing one subscriber does not affect others")
        void othersKept() {
            List<ZeroEvent> received = new ArrayList<>();
            var first = eventBus.subscribe("SCAN-2026-0001", e -> { });
            eventBus.subscribe("SCAN-2026-0001", received::add);

            first.unsubscribe();
            eventBus.publish(event("job.started", "SCAN-2026-0001"));

            assertEquals(1, received.size());
            assertEquals(1, eventBus.subscriberCount("SCAN-2026-0001"));
        }

        @Test
        @DisplayName("unsubscribing a global subscription stops delivery")
        void unsubscribeGlobal() {
            List<ZeroEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribeAll(received::add);
            subscription.unsubscribe();

            eventBus.publish(event("job.started", "SCAN-2026-0001"));

            assertTrue(received.isEmpty());
        }
    }

    // -- Robustness -----------------------------------------------------------

    @Nested
    @DisplayName("robustness")
    class RobustnessTests {

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void throwingSubscriber() {
            List<ZeroEvent> received = new ArrayList<>();
            eventBus.subscribe("SCAN-2026-0001", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("SCAN-2026-0001", received::add);

            assertDoesNotThrow(() -> eventBus.publish(event("job.started", "SCAN-2026-0001")));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("handles concurrent publishes from analyzer threads")
        void concurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<ZeroEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("SCAN-2026-0001", received::add);

            int threadCount = 8;
            int eventsPerThread = 100;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publish(event("analyzer.completed", "SCAN-2026-0001"));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }
    }
}
