package com.aiide.backbone.core.pool;

/**
 * A pooled resource and its bookkeeping. Owned by the pool; mutated only
 * under the pool lock.
 */
final class PoolEntry<T> {

    private final T resource;
    private long lastUsedAt;
    private boolean inUse;

    PoolEntry(T resource, long now) {
        this.resource = resource;
        this.lastUsedAt = now;
    }

    T resource() {
        return resource;
    }

    void markLeased() {
        inUse = true;
    }

    void markIdle(long now) {
        inUse = false;
        lastUsedAt = now;
    }

    boolean idleLongerThan(long nanos, long now) {
        return !inUse && now - lastUsedAt >= nanos;
    }
}
