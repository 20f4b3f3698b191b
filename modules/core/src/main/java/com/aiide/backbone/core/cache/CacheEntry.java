package com.aiide.backbone.core.cache;

/**
 * Immutable cache slot. A read replaces nothing, so readers never see a
 * half-written entry; expiry is fixed at insertion.
 */
record CacheEntry<V>(V value, long insertedAt, long expiresAt, long weight) {

    boolean isExpired(long now) {
        return now - expiresAt >= 0;
    }
}
