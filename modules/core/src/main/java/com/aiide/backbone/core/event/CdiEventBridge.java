package com.aiide.backbone.core.event;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Re-fires every {@link BackboneEvent} as a CDI event so beans can
 * {@code @Observes BackboneEvent} instead of subscribing to the bus.
 */
@Startup
@Singleton
public class CdiEventBridge {

    @Inject
    EventBus bus;

    @Inject
    Event<BackboneEvent> cdiEvent;

    private Subscription subscription;

    @PostConstruct
    void connect() {
        subscription = bus.subscribeAll(cdiEvent::fire);
    }

    @PreDestroy
    void disconnect() {
        if (subscription != null) subscription.close();
    }
}
