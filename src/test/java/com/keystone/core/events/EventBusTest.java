package com.keystone.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
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

    private static GovernanceEvent event(String type, String subjectId) {
        return new GovernanceEvent(type, subjectId, null, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("GovernanceEvent")
    class GovernanceEventTests {

        @Test
        @DisplayName("of() fills an empty payload and a timestamp")
        void factoryDefaults() {
            var event = GovernanceEvent.of("task.admitted", "KST-2026-0001", null, null);

            assertEquals(Map.of(), event.payload());
            assertNotNull(event.timestamp());
            assertNull(event.stage());
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to subject subscriber")
        void deliversToSubject() {
            List<GovernanceEvent> received = new ArrayList<>();
            eventBus.subscribe("KST-2026-0001", received::add);

            var event = event("stage.started", "KST-2026-0001");
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different task")
        void doesNotDeliverToDifferentSubject() {
            List<GovernanceEvent> received = new ArrayList<>();
            eventBus.subscribe("KST-2026-0002", received::add);

            eventBus.publish(event("stage.started", "KST-2026-0001"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers multiple events in order")
        void deliversInOrder() {
            List<GovernanceEvent> received = new ArrayList<>();
            eventBus.subscribe("KST-2026-0001", received::add);

            eventBus.publish(event("task.admitted", "KST-2026-0001"));
            eventBus.publish(event("stage.started", "KST-2026-0001"));
            eventBus.publish(event("stage.completed", "KST-2026-0001"));

            assertEquals(List.of("task.admitted", "stage.started", "stage.completed"),
                    received.stream().map(GovernanceEvent::eventType).toList());
        }

        @Test
        @DisplayName("unsubscribing stops delivery without affecting others")
        void unsubscribe() {
            List<GovernanceEvent> received1 = new ArrayList<>();
            List<GovernanceEvent> received2 = new ArrayList<>();
            EventBus.Subscription sub1 = eventBus.subscribe("KST-2026-0001", received1::add);
            eventBus.subscribe("KST-2026-0001", received2::add);

            sub1.unsubscribe();
            eventBus.publish(event("stage.started", "KST-2026-0001"));

            assertTrue(received1.isEmpty());
            assertEquals(1, received2.size());
        }
    }

    @Nested
    @DisplayName("replay")
    class ReplayTests {

        @Test
        @DisplayName("a late subscriber receives the remembered events, then live ones")
        void replaysThenGoesLive() {
            eventBus.publish(event("task.admitted", "KST-2026-0001"));
            eventBus.publish(event("stage.completed", "KST-2026-0001"));
            eventBus.publish(event("task.admitted", "KST-2026-0002"));

            List<GovernanceEvent> received = new ArrayList<>();
            eventBus.subscribeWithReplay("KST-2026-0001", received::add);
            eventBus.publish(event("task.completed", "KST-2026-0001"));

            assertEquals(List.of("task.admitted", "stage.completed", "task.completed"),
                    received.stream().map(GovernanceEvent::eventType).toList());
        }

        @Test
        @DisplayName("a plain subscription does not replay")
        void plainSubscribeSkipsHistory() {
            eventBus.publish(event("task.admitted", "KST-2026-0001"));

            List<GovernanceEvent> received = new ArrayList<>();
            eventBus.subscribe("KST-2026-0001", received::add);

            assertTrue(received.isEmpty());
            assertEquals(1, eventBus.recent("KST-2026-0001").size());
        }

        @Test
        @DisplayName("keeps only the newest events of the most recently active subjects")
        void boundedHistory() {
            EventBus small = new EventBus(2, 2);
            small.publish(event("task.admitted", "KST-2026-0001"));
            small.publish(event("stage.started", "KST-2026-0001"));
            small.publish(event("stage.completed", "KST-2026-0001"));
            small.publish(event("task.admitted", "KST-2026-0002"));
            small.publish(event("task.admitted", "KST-2026-0003"));

            assertTrue(small.recent("KST-2026-0001").isEmpty(), "least recently active subject is dropped");
            assertEquals(1, small.recent("KST-2026-0002").size());
            assertEquals(1, small.recent("KST-2026-0003").size());

            EventBus perSubject = new EventBus(2, 8);
            perSubject.publish(event("task.admitted", "KST-2026-0001"));
            perSubject.publish(event("stage.started", "KST-2026-0001"));
            perSubject.publish(event("stage.completed", "KST-2026-0001"));
            assertEquals(List.of("stage.started", "stage.completed"),
                    perSubject.recent("KST-2026-0001").stream().map(GovernanceEvent::eventType).toList());
        }

        @Test
        @DisplayName("rejects non-positive bounds")
        void invalidBounds() {
            assertThrows(IllegalArgumentException.class, () -> new EventBus(0, 10));
            assertThrows(IllegalArgumentException.class, () -> new EventBus(10, 0));
        }
    }

    @Nested
    @DisplayName("edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("subscriber exception does not prevent delivery to other subscribers")
        void failingSubscriber() {
            List<GovernanceEvent> received = new ArrayList<>();
            eventBus.subscribe("KST-2026-0001", e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribe("KST-2026-0001", received::add);

            eventBus.publish(event("stage.failed", "KST-2026-0001"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("handles concurrent publishes safely")
        void concurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<GovernanceEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("KST-2026-0001", received::add);

            int threadCount = 8;
            int eventsPerThread = 50;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publish(event("stage.completed", "KST-2026-0001"));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }
    }
}
