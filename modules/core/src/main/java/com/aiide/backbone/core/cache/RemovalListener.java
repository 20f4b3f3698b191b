package com.aiide.backbone.core.cache;

/**
 * Called once per removed entry, after it is unlinked and before the call that
 * removed it returns. Never called while the cache lock is held.
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

    void onRemoval(K key, V value, RemovalCause cause);
}
