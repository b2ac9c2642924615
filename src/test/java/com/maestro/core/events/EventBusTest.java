package com.maestro.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

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

    @Nested
    @DisplayName("MaestroEvent")
    class MaestroEventTests {

        @Test
        @DisplayName("of() stamps the event and defaults a null payload")
        void ofDefaultsPayload() {
            var event = MaestroEvent.of("stage.started", "01-brainstorm", null);

            assertEquals("stage.started", event.eventType());
            assertEquals("01-brainstorm", event.stageId());
            assertEquals(Map.of(), event.payload());
            assertNotNull(event.timestamp());
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("global subscribers receive events without a stage")
        void globalReceivesEverything() {
            List<MaestroEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(MaestroEvent.of("pipeline.initialized", null, Map.of()));
            eventBus.publish(MaestroEvent.of("debate.round.completed", "03-planning", Map.of("round", 1)));

            assertEquals(List.of("pipeline.initialized", "debate.round.completed"),
                    received.stream().map(MaestroEvent::eventType).toList());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<MaestroEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribeAll(received::add);
            subscription.unsubscribe();

            eventBus.publish(MaestroEvent.of("stage.started", "01-brainstorm", Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a throwing subscriber does not block others")
        void throwingSubscriberIsolated() {
            List<MaestroEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> { throw new RuntimeException("boom"); });
            eventBus.subscribeAll(received::add);

            eventBus.publish(MaestroEvent.of("stage.started", "01-brainstorm", Map.of()));

            assertEquals(1, received.size());
        }
    }

    @Test
    @DisplayName("concurrent publishers deliver every event")
    void concurrentPublish() throws InterruptedException {
        List<MaestroEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(received::add);
        int threads = 8;
        var done = new CountDownLatch(threads);
        for (int i = 0; i < threads; i++) {
            int n = i;
            new Thread(() -> {
                eventBus.publish(MaestroEvent.of("agent.failed", "03-planning", Map.of("n", n)));
                done.countDown();
            }).start();
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(threads, received.size());
    }
}
