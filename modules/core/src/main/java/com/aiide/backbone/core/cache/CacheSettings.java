package com.aiide.backbone.core.cache;

import com.aiide.backbone.util.Durations;

import java.time.Duration;

public record CacheSettings(int maxEntries, long maxBytes, Duration defaultTtl) {

    public CacheSettings {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1, was " + maxEntries);
        }
        if (maxBytes < 1) {
            throw new IllegalArgumentException("maxBytes must be at least 1, was " + maxBytes);
        }
        Durations.requirePositive(defaultTtl, "defaultTtl");
    }

    public static CacheSettings defaults() {
        return new CacheSettings(1000, 50L * 1024 * 1024, Duration.ofMinutes(5));
    }
}
