package com.aiide.backbone.core.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class EventBusTest {

    private final EventBus bus = new EventBus();

    @Test
    void subscribersOnlyReceiveTheirKind() {
        List<BackboneEvent> ready = new CopyOnWriteArrayList<>();
        List<BackboneEvent> all = new CopyOnWriteArrayList<>();
        bus.subscribe(EventKind.SERVICE_READY, ready::add);
        bus.subscribeAll(all::add);

        bus.publish(EventKind.SERVICE_READY, "db", "");
        bus.publish(EventKind.CACHE_EVICTED, "completions:k", "SIZE");

        assertThat(ready).extracting(BackboneEvent::subject).containsExactly("db");
        assertThat(all).extracting(BackboneEvent::kind)
                .containsExactly(EventKind.SERVICE_READY, EventKind.CACHE_EVICTED);
    }

    @Test
    void eventsArriveInPublishOrder() {
        List<String> seen = new ArrayList<>();
        bus.subscribe(EventKind.SERVICE_STATE_CHANGED, e -> seen.add(e.detail()));

        bus.publish(EventKind.SERVICE_STATE_CHANGED, "db", "UNINITIALIZED -> INITIALIZING");
        bus.publish(EventKind.SERVICE_STATE_CHANGED, "db", "INITIALIZING -> READY");

        assertThat(seen).containsExactly("UNINITIALIZED -> INITIALIZING", "INITIALIZING -> READY");
    }

    @Test
    void failingListenerDoesNotAffectOthersOrThePublisher() {
        List<BackboneEvent> received = new CopyOnWriteArrayList<>();
        bus.subscribe(EventKind.TASK_FAILED, e -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe(EventKind.TASK_FAILED, received::add);

        bus.publish(EventKind.TASK_FAILED, "indexer", "boom");

        assertThat(received).hasSize(1);
    }

    @Test
    void closedSubscriptionStopsDelivery() {
        AtomicInteger count = new AtomicInteger();
        Subscription subscription = bus.subscribe(EventKind.RATE_LIMITED, e -> count.incrementAndGet());

        bus.publish(EventKind.RATE_LIMITED, "k", "");
        subscription.close();
        bus.publish(EventKind.RATE_LIMITED, "k", "");

        assertThat(count).hasValue(1);
        assertThat(subscription.isActive()).isFalse();
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void aSubscriberNeverRunsConcurrentlyWithItself() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger overlaps = new AtomicInteger();
        AtomicInteger delivered = new AtomicInteger();
        bus.subscribeAll(e -> {
            if (inside.incrementAndGet() > 1) {
                overlaps.incrementAndGet();
            }
            delivered.incrementAndGet();
            inside.decrementAndGet();
        });

        int publishers = 4;
        CountDownLatch done = new CountDownLatch(publishers);
        ExecutorService pool = Executors.newFixedThreadPool(publishers);
        try {
            for (int p = 0; p < publishers; p++) {
                pool.execute(() -> {
                    for (int i = 0; i < 500; i++) {
                        bus.publish(EventKind.POOL_EXHAUSTED, "db", "");
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(overlaps).hasValue(0);
        assertThat(delivered).hasValue(2000);
    }
}
