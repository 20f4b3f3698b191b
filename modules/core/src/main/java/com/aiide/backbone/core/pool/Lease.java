package com.aiide.backbone.core.pool;

import org.jboss.logging.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Temporary borrow of a pooled resource. Must be returned exactly once, either
 * by {@link #close()} (back to the pool) or {@link #discard()} (destroyed). Use
 * with try-with-resources; a second return is ignored.
 */
public final class Lease<T> implements AutoCloseable {

    private static final Logger log = Logger.getLogger(Lease.class);

    private final ResourcePool<T> pool;
    private final PoolEntry<T> entry;
    private final AtomicBoolean returned = new AtomicBoolean();

    Lease(ResourcePool<T> pool, PoolEntry<T> entry) {
        this.pool = pool;
        this.entry = entry;
    }

    public T get() {
        if (returned.get()) {
            throw new IllegalStateException("Lease on pool '" + pool.name() + "' was already returned");
        }
        return entry.resource();
    }

    public boolean isReturned() {
        return returned.get();
    }

    /** Returns the resource to the pool. */
    @Override
    public void close() {
        giveBack(false);
    }

    /** Destroys the resource instead of returning it, e.g. after a protocol error. */
    public void discard() {
        giveBack(true);
    }

    private void giveBack(boolean destroy) {
        if (!returned.compareAndSet(false, true)) {
            log.debugf("Ignoring second return of lease on pool '%s'", pool.name());
            return;
        }
        pool.giveBack(entry, destroy);
    }
}
