package com.conduit.events;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for control plane notifications.
 * <p>
 * Subscribers register either for a single event type or for every event. Delivery is synchronous
 * on the publishing thread; a subscriber that throws is logged and skipped.
 */
@Slf4j
@Component
public class EventBus {

    private final Clock clock;

    /** Subscribers keyed by event type. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ControlPlaneEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ControlPlaneEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public EventBus(Clock clock) {
        this.clock = clock;
    }

    public void publish(String eventType, String source, Object payload) {
        publish(new ControlPlaneEvent(eventType, source, payload, clock.instant()));
    }

    public void publish(ControlPlaneEvent event) {
        log.debug("Publishing event: {} from {}", event.eventType(), event.source());

        List<Consumer<ControlPlaneEvent>> subs = typeSubscribers.get(event.eventType());
        if (subs != null) {
            for (Consumer<ControlPlaneEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<ControlPlaneEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to a single event type.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String eventType, Consumer<ControlPlaneEvent> consumer) {
        typeSubscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<ControlPlaneEvent>> subs = typeSubscribers.get(eventType);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<ControlPlaneEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @PreDestroy
    public void clear() {
        typeSubscribers.clear();
        globalSubscribers.clear();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ControlPlaneEvent> subscriber, ControlPlaneEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
