package com.aiide.backbone.core.event;

import org.jboss.logging.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-wide publish/subscribe channel for lifecycle, cache, pool, rate-limit
 * and task transitions.
 * <p>
 * Delivery is synchronous on the publishing thread. Each subscriber is
 * serialized on its own monitor, so a subscriber observes the events of one
 * publisher in publish order and never runs concurrently with itself. A
 * listener that throws is logged and skipped; it does not affect the publisher
 * or other subscribers. Publishers must not hold their own locks while calling
 * {@link #publish}. Nothing is persisted.
 */
public class EventBus {

    private static final Logger log = Logger.getLogger(EventBus.class);

    private final Map<EventKind, List<Subscriber>> byKind = new EnumMap<>(EventKind.class);
    private final List<Subscriber> wildcard = new CopyOnWriteArrayList<>();

    public EventBus() {
        for (EventKind kind : EventKind.values()) {
            byKind.put(kind, new CopyOnWriteArrayList<>());
        }
    }

    public Subscription subscribe(EventKind kind, EventListener listener) {
        Objects.requireNonNull(kind, "kind");
        Subscriber subscriber = new Subscriber(Objects.requireNonNull(listener, "listener"), byKind.get(kind));
        byKind.get(kind).add(subscriber);
        return subscriber;
    }

    /** Subscribes to every kind of event. */
    public Subscription subscribeAll(EventListener listener) {
        Subscriber subscriber = new Subscriber(Objects.requireNonNull(listener, "listener"), wildcard);
        wildcard.add(subscriber);
        return subscriber;
    }

    public void publish(BackboneEvent event) {
        Objects.requireNonNull(event, "event");
        for (Subscriber s : byKind.get(event.kind())) {
            s.deliver(event);
        }
        for (Subscriber s : wildcard) {
            s.deliver(event);
        }
    }

    public void publish(EventKind kind, String subject, String detail) {
        publish(BackboneEvent.of(kind, subject, detail));
    }

    public int subscriberCount() {
        int count = wildcard.size();
        for (List<Subscriber> list : byKind.values()) {
            count += list.size();
        }
        return count;
    }

    private static final class Subscriber implements Subscription {

        private final EventListener listener;
        private final List<Subscriber> owner;
        private volatile boolean active = true;

        Subscriber(EventListener listener, List<Subscriber> owner) {
            this.listener = listener;
            this.owner = owner;
        }

        synchronized void deliver(BackboneEvent event) {
            if (!active) {
                return;
            }
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.errorf(e, "Event listener failed on %s for '%s'", event.kind(), event.subject());
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            active = false;
            owner.remove(this);
        }
    }
}
