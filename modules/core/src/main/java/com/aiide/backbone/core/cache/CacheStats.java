package com.aiide.backbone.core.cache;

public record CacheStats(
        String name,
        int size,
        long weight,
        long hits,
        long misses,
        long puts,
        long expired,
        long evictedBySize,
        long invalidated
) {
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
