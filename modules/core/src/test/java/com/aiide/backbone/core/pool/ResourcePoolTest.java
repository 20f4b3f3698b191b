package com.aiide.backbone.core.pool;

import com.aiide.backbone.core.BackboneException;
import com.aiide.backbone.core.OperationTimeoutException;
import com.aiide.backbone.core.ShutdownInProgressException;
import com.aiide.backbone.core.event.BackboneEvent;
import com.aiide.backbone.core.event.EventBus;
import com.aiide.backbone.core.event.EventKind;
import com.aiide.backbone.util.ManualTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourcePoolTest {

    private final ManualTicker ticker = new ManualTicker();
    private final EventBus events = new EventBus();
    private final List<BackboneEvent> published = new CopyOnWriteArrayList<>();
    private FakeConnectionFactory factory;

    @BeforeEach
    void setUp() {
        events.subscribeAll(published::add);
        factory = new FakeConnectionFactory();
    }

    private ResourcePool<FakeConnection> pool(int maxSize) {
        return new ResourcePool<>("db", factory,
                new PoolSettings(maxSize, Duration.ofSeconds(1), Duration.ofMinutes(5)), ticker, events);
    }

    @Test
    void returnedEntriesAreReused() {
        ResourcePool<FakeConnection> pool = pool(2);

        FakeConnection first;
        try (Lease<FakeConnection> lease = pool.acquire()) {
            first = lease.get();
        }
        try (Lease<FakeConnection> lease = pool.acquire()) {
            assertThat(lease.get()).isSameAs(first);
        }
        assertThat(factory.created).hasValue(1);
        assertThat(pool.stats().idle()).isEqualTo(1);
        assertThat(pool.stats().acquired()).isEqualTo(2);
    }

    @Test
    void exhaustedPoolTimesOutWithDistinctError() {
        ResourcePool<FakeConnection> pool = pool(1);
        Lease<FakeConnection> held = pool.acquire();

        assertThatThrownBy(() -> pool.acquire(Duration.ofMillis(50)))
                .isInstanceOf(PoolExhaustedException.class)
                .isInstanceOf(OperationTimeoutException.class)
                .hasMessageContaining("db");
        assertThat(pool.stats().timeouts()).isEqualTo(1);
        assertThat(published).extracting(BackboneEvent::kind).contains(EventKind.POOL_EXHAUSTED);

        held.close();
        try (Lease<FakeConnection> lease = pool.acquire(Duration.ofMillis(50))) {
            assertThat(lease.get()).isNotNull();
        }
    }

    @Test
    void waiterIsServedWhenALeaseComesBack() throws Exception {
        ResourcePool<FakeConnection> pool = pool(1);
        Lease<FakeConnection> held = pool.acquire();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<FakeConnection> waiter = executor.submit(() -> {
                try (Lease<FakeConnection> lease = pool.acquire(Duration.ofSeconds(5))) {
                    return lease.get();
                }
            });
            Thread.sleep(50);
            FakeConnection heldConnection = held.get();
            held.close();

            assertThat(waiter.get(5, TimeUnit.SECONDS)).isSameAs(heldConnection);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void capacityIsNeverExceededUnderContention() throws Exception {
        int maxSize = 3;
        ResourcePool<FakeConnection> pool = pool(maxSize);
        AtomicInteger inUse = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(10);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                futures.add(executor.submit(() -> pool.withResource(conn -> {
                    int now = inUse.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    Thread.sleep(2);
                    inUse.decrementAndGet();
                    return null;
                }, Duration.ofSeconds(10))));
            }
            for (Future<?> f : futures) {
                f.get(20, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(peak.get()).isLessThanOrEqualTo(maxSize);
        assertThat(factory.created.get()).isLessThanOrEqualTo(maxSize);
        assertThat(pool.stats().leased()).isZero();
    }

    @Test
    void withResourceReturnsTheEntryWhenTheFunctionThrows() {
        ResourcePool<FakeConnection> pool = pool(1);

        assertThatThrownBy(() -> pool.withResource(conn -> {
            throw new IOException("socket reset");
        })).isInstanceOf(BackboneException.class).hasCauseInstanceOf(IOException.class);

        assertThatThrownBy(() -> pool.withResource(conn -> {
            throw new IllegalStateException("bad query");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(pool.stats().leased()).isZero();
        assertThat(pool.stats().idle()).isEqualTo(1);
    }

    @Test
    void doubleReturnIsIgnored() {
        ResourcePool<FakeConnection> pool = pool(2);
        Lease<FakeConnection> lease = pool.acquire();

        lease.close();
        lease.close();

        assertThat(lease.isReturned()).isTrue();
        assertThat(pool.stats().idle()).isEqualTo(1);
        assertThat(pool.stats().leased()).isZero();
        assertThatThrownBy(lease::get).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void discardedEntryIsDestroyedAndItsSlotFreed() {
        ResourcePool<FakeConnection> pool = pool(1);
        Lease<FakeConnection> lease = pool.acquire();
        FakeConnection broken = lease.get();

        lease.discard();

        assertThat(broken.closed).isTrue();
        try (Lease<FakeConnection> fresh = pool.acquire(Duration.ofMillis(50))) {
            assertThat(fresh.get()).isNotSameAs(broken);
        }
        assertThat(pool.stats().destroyed()).isEqualTo(1);
    }

    @Test
    void idleEntryFailingValidationIsReplaced() {
        ResourcePool<FakeConnection> pool = pool(1);
        FakeConnection stale;
        try (Lease<FakeConnection> lease = pool.acquire()) {
            stale = lease.get();
        }
        stale.healthy.set(false);

        try (Lease<FakeConnection> lease = pool.acquire()) {
            assertThat(lease.get()).isNotSameAs(stale);
        }
        assertThat(stale.closed).isTrue();
        assertThat(factory.created).hasValue(2);
    }

    @Test
    void factoryFailureFreesTheSlot() {
        ResourcePool<FakeConnection> pool = pool(1);
        factory.failNext.set(true);

        assertThatThrownBy(pool::acquire)
                .isInstanceOf(BackboneException.class)
                .hasMessageContaining("Failed to create");

        try (Lease<FakeConnection> lease = pool.acquire(Duration.ofMillis(50))) {
            assertThat(lease.get()).isNotNull();
        }
    }

    @Test
    void evictIdleDestroysOnlyEntriesPastMaxIdle() {
        ResourcePool<FakeConnection> pool = pool(2);
        Lease<FakeConnection> a = pool.acquire();
        Lease<FakeConnection> b = pool.acquire();
        FakeConnection old = a.get();
        a.close();
        ticker.advance(Duration.ofMinutes(4));
        b.close();
        ticker.advance(Duration.ofMinutes(2));

        assertThat(pool.evictIdle()).isEqualTo(1);
        assertThat(old.closed).isTrue();
        assertThat(pool.stats().idle()).isEqualTo(1);
    }

    @Test
    void closeDestroysIdleEntriesAndRejectsAcquires() {
        ResourcePool<FakeConnection> pool = pool(2);
        Lease<FakeConnection> leased = pool.acquire();
        FakeConnection idle;
        try (Lease<FakeConnection> lease = pool.acquire()) {
            idle = lease.get();
        }

        pool.close();

        assertThat(idle.closed).isTrue();
        assertThat(pool.isClosed()).isTrue();
        assertThatThrownBy(pool::acquire).isInstanceOf(ShutdownInProgressException.class);

        FakeConnection outstanding = leased.get();
        leased.close();
        assertThat(outstanding.closed).isTrue();
    }

    static final class FakeConnection implements AutoCloseable {
        final AtomicBoolean healthy = new AtomicBoolean(true);
        volatile boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }

    static final class FakeConnectionFactory implements PooledResourceFactory<FakeConnection> {
        final AtomicInteger created = new AtomicInteger();
        final AtomicBoolean failNext = new AtomicBoolean();

        @Override
        public FakeConnection create() throws IOException {
            if (failNext.getAndSet(false)) {
                throw new IOException("connection refused");
            }
            created.incrementAndGet();
            return new FakeConnection();
        }

        @Override
        public boolean validate(FakeConnection resource) {
            return resource.healthy.get();
        }
    }
}
