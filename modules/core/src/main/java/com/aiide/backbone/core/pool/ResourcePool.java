package com.aiide.backbone.core.pool;

import com.aiide.backbone.core.BackboneException;
import com.aiide.backbone.core.ShutdownInProgressException;
import com.aiide.backbone.core.event.EventBus;
import com.aiide.backbone.core.event.EventKind;
import com.aiide.backbone.util.Ticker;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of reusable expensive handles.
 * <p>
 * {@code acquire} hands out an idle entry if one exists, creates a new one if
 * capacity allows, and otherwise waits up to the timeout before failing with
 * {@link PoolExhaustedException}. At every instant
 * {@code idle + leased + creating <= maxSize}. Idle entries are validated
 * lazily when handed out; creation, validation and destruction run outside the
 * pool lock.
 */
public class ResourcePool<T> implements AutoCloseable {

    private static final Logger log = Logger.getLogger(ResourcePool.class);

    private final String name;
    private final PooledResourceFactory<T> factory;
    private final PoolSettings settings;
    private final Ticker ticker;
    private final EventBus events;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Deque<PoolEntry<T>> idle = new ArrayDeque<>();

    // guarded by lock
    private int leased;
    private int creating;
    private boolean closed;
    private long created;
    private long destroyed;
    private long acquired;
    private long timeouts;

    public ResourcePool(String name, PooledResourceFactory<T> factory, PoolSettings settings,
                        Ticker ticker, EventBus events) {
        this.name = Objects.requireNonNull(name, "name");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.events = Objects.requireNonNull(events, "events");
    }

    public String name() {
        return name;
    }

    public PoolSettings settings() {
        return settings;
    }

    public Lease<T> acquire() {
        return acquire(settings.acquireTimeout());
    }

    /**
     * @throws PoolExhaustedException      if nothing became available in time
     * @throws ShutdownInProgressException if the pool is closed
     */
    public Lease<T> acquire(Duration timeout) {
        long remaining = timeout.toNanos();
        while (true) {
            PoolEntry<T> candidate = null;
            boolean mustCreate = false;

            lock.lock();
            try {
                while (true) {
                    if (closed) {
                        throw new ShutdownInProgressException("Pool '" + name + "' is closed");
                    }
                    if (!idle.isEmpty()) {
                        candidate = idle.pollFirst();
                        candidate.markLeased();
                        leased++;
                        acquired++;
                        break;
                    }
                    if (leased + creating < settings.maxSize()) {
                        creating++;
                        mustCreate = true;
                        break;
                    }
                    if (remaining <= 0) {
                        timeouts++;
                        break;
                    }
                    remaining = available.awaitNanos(remaining);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackboneException("Interrupted while acquiring from pool '" + name + "'", e);
            } finally {
                lock.unlock();
            }

            if (mustCreate) {
                return createLease();
            }
            if (candidate == null) {
                events.publish(EventKind.POOL_EXHAUSTED, name, "waited " + timeout);
                throw new PoolExhaustedException(name, settings.maxSize(), timeout);
            }
            if (isHealthy(candidate)) {
                return new Lease<>(this, candidate);
            }
            log.debugf("Pool '%s': idle entry failed validation, discarding", name);
            giveBack(candidate, true);
        }
    }

    /**
     * Runs {@code fn} with a leased resource and returns the lease on every exit
     * path. Checked exceptions from {@code fn} are wrapped in {@link BackboneException}.
     * If {@code fn} throws an {@link Error} the resource is destroyed instead of reused.
     */
    public <R> R withResource(LeaseFunction<T, R> fn, Duration timeout) {
        Lease<T> lease = acquire(timeout);
        try {
            return fn.apply(lease.get());
        } catch (RuntimeException e) {
            throw e;
        } catch (Error e) {
            lease.discard();
            throw e;
        } catch (Exception e) {
            throw new BackboneException("Operation on pool '" + name + "' failed", e);
        } finally {
            lease.close();
        }
    }

    public <R> R withResource(LeaseFunction<T, R> fn) {
        return withResource(fn, settings.acquireTimeout());
    }

    /**
     * Destroys idle entries unused for longer than {@link PoolSettings#maxIdle()}.
     *
     * @return number of entries destroyed
     */
    public int evictIdle() {
        List<PoolEntry<T>> stale = new ArrayList<>();
        long now = ticker.nanos();
        long maxIdle = settings.maxIdle().toNanos();
        lock.lock();
        try {
            Iterator<PoolEntry<T>> it = idle.iterator();
            while (it.hasNext()) {
                PoolEntry<T> entry = it.next();
                if (entry.idleLongerThan(maxIdle, now)) {
                    it.remove();
                    stale.add(entry);
                }
            }
            destroyed += stale.size();
            if (!stale.isEmpty()) {
                available.signalAll();
            }
        } finally {
            lock.unlock();
        }
        for (PoolEntry<T> entry : stale) {
            destroyQuietly(entry);
        }
        if (!stale.isEmpty()) {
            log.debugf("Pool '%s': evicted %d idle entries", name, stale.size());
        }
        return stale.size();
    }

    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(name, settings.maxSize(), idle.size(), leased,
                    created, destroyed, acquired, timeouts);
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Destroys idle entries and rejects further acquires. Entries still leased
     * are destroyed when they come back.
     */
    @Override
    public void close() {
        List<PoolEntry<T>> drained;
        int stillLeased;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            drained = new ArrayList<>(idle);
            idle.clear();
            destroyed += drained.size();
            stillLeased = leased;
            available.signalAll();
        } finally {
            lock.unlock();
        }
        for (PoolEntry<T> entry : drained) {
            destroyQuietly(entry);
        }
        if (stillLeased > 0) {
            log.warnf("Pool '%s' closed with %d leases outstanding", name, stillLeased);
        } else {
            log.infof("Pool '%s' closed", name);
        }
    }

    void giveBack(PoolEntry<T> entry, boolean destroy) {
        boolean destroyNow;
        lock.lock();
        try {
            leased--;
            destroyNow = destroy || closed;
            if (destroyNow) {
                destroyed++;
            } else {
                entry.markIdle(ticker.nanos());
                idle.addFirst(entry);
            }
            available.signal();
        } finally {
            lock.unlock();
        }
        if (destroyNow) {
            destroyQuietly(entry);
        }
    }

    private Lease<T> createLease() {
        T resource;
        try {
            resource = factory.create();
            if (resource == null) {
                throw new IllegalStateException("factory returned null");
            }
        } catch (Exception e) {
            lock.lock();
            try {
                creating--;
                available.signal();
            } finally {
                lock.unlock();
            }
            throw new BackboneException("Failed to create resource for pool '" + name + "'", e);
        }

        PoolEntry<T> entry = new PoolEntry<>(resource, ticker.nanos());
        entry.markLeased();
        boolean orphaned;
        lock.lock();
        try {
            creating--;
            orphaned = closed;
            if (orphaned) {
                destroyed++;
            } else {
                leased++;
                created++;
                acquired++;
            }
        } finally {
            lock.unlock();
        }
        if (orphaned) {
            destroyQuietly(entry);
            throw new ShutdownInProgressException("Pool '" + name + "' closed during acquire");
        }
        log.debugf("Pool '%s': created entry", name);
        return new Lease<>(this, entry);
    }

    private boolean isHealthy(PoolEntry<T> entry) {
        try {
            return factory.validate(entry.resource());
        } catch (Exception e) {
            log.debugf(e, "Pool '%s': validation threw", name);
            return false;
        }
    }

    private void destroyQuietly(PoolEntry<T> entry) {
        try {
            factory.destroy(entry.resource());
        } catch (Exception e) {
            log.warnf(e, "Pool '%s': error destroying resource", name);
        }
    }
}
