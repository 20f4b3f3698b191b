package com.aiide.backbone.core.cache;

public enum RemovalCause {
    /** TTL elapsed; reclaimed by a read or by the sweep. */
    EXPIRED,
    /** Least recently used entry dropped to respect the entry or byte bound. */
    SIZE,
    /** Removed by {@code invalidate}. */
    EXPLICIT,
    /** Overwritten by a later {@code put} for the same key. */
    REPLACED;

    public boolean isEviction() {
        return this == EXPIRED || this == SIZE;
    }
}
