package com.aiide.backbone.core.pool;

import com.aiide.backbone.core.ShutdownInProgressException;
import com.aiide.backbone.core.event.EventBus;
import com.aiide.backbone.util.Ticker;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named pools shared by every service. Consumers go through
 * {@link #withConnection} and never touch entries directly.
 */
public class PoolRegistry {

    private static final Logger log = Logger.getLogger(PoolRegistry.class);

    private final PoolSettings defaults;
    private final Ticker ticker;
    private final EventBus events;
    private final Map<String, ResourcePool<?>> pools = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public PoolRegistry(PoolSettings defaults, Ticker ticker, EventBus events) {
        this.defaults = defaults;
        this.ticker = ticker;
        this.events = events;
    }

    public <T> ResourcePool<T> register(String name, PooledResourceFactory<T> factory) {
        return register(name, factory, defaults);
    }

    public <T> ResourcePool<T> register(String name, PooledResourceFactory<T> factory, PoolSettings settings) {
        if (closed) {
            throw new ShutdownInProgressException("Pool registry is closed; cannot register '" + name + "'");
        }
        ResourcePool<T> pool = new ResourcePool<>(name, factory, settings, ticker, events);
        if (pools.putIfAbsent(name, pool) != null) {
            throw new IllegalArgumentException("Pool already registered: " + name);
        }
        log.infof("Registered pool '%s' (maxSize=%d)", name, settings.maxSize());
        return pool;
    }

    @SuppressWarnings("unchecked")
    public <T> ResourcePool<T> pool(String name) {
        ResourcePool<?> pool = pools.get(name);
        if (pool == null) {
            throw new IllegalArgumentException("Unknown pool: " + name);
        }
        return (ResourcePool<T>) pool;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<ResourcePool<T>> find(String name) {
        return Optional.ofNullable((ResourcePool<T>) pools.get(name));
    }

    /** Scoped helper: the lease is returned whether {@code fn} returns or throws. */
    public <T, R> R withConnection(String name, LeaseFunction<T, R> fn, Duration timeout) {
        ResourcePool<T> pool = pool(name);
        return pool.withResource(fn, timeout);
    }

    public <T, R> R withConnection(String name, LeaseFunction<T, R> fn) {
        ResourcePool<T> pool = pool(name);
        return pool.withResource(fn);
    }

    public PoolSettings defaults() {
        return defaults;
    }

    public int evictIdle() {
        int total = 0;
        for (ResourcePool<?> pool : pools.values()) {
            total += pool.evictIdle();
        }
        return total;
    }

    public List<PoolStats> stats() {
        List<PoolStats> stats = new ArrayList<>();
        for (ResourcePool<?> pool : pools.values()) {
            stats.add(pool.stats());
        }
        stats.sort(Comparator.comparing(PoolStats::name));
        return stats;
    }

    public void closeAll() {
        closed = true;
        for (ResourcePool<?> pool : pools.values()) {
            pool.close();
        }
    }
}
