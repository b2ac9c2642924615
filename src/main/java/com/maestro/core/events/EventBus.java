package com.maestro.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for pipeline execution events.
 * <p>
 * Every subscriber receives every event; consumers filter on {@link MaestroEvent#stageId()} or the event type.
 * Thread-safe for concurrent publish and subscribe operations; debate agents publish from worker threads.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<MaestroEvent>> subscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to every subscriber.
     *
     * @param event the event to publish
     */
    public void publish(MaestroEvent event) {
        log.debug("Publishing event: {} for stage {}", event.eventType(), event.stageId());

        for (Consumer<MaestroEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events from every stage.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<MaestroEvent> consumer) {
        subscribers.add(consumer);
        log.debug("Subscribed to all events");
        return () -> subscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<MaestroEvent> subscriber, MaestroEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
