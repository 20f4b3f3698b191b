package com.aiide.backbone.core.pool;

import com.aiide.backbone.util.Durations;

import java.time.Duration;

/**
 * @param maxSize        hard cap on idle plus leased plus in-creation entries
 * @param acquireTimeout default wait for {@link ResourcePool#acquire()}
 * @param maxIdle        idle entries older than this are destroyed by {@link ResourcePool#evictIdle()}
 */
public record PoolSettings(int maxSize, Duration acquireTimeout, Duration maxIdle) {

    public PoolSettings {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, was " + maxSize);
        }
        Durations.requirePositive(acquireTimeout, "acquireTimeout");
        Durations.requirePositive(maxIdle, "maxIdle");
    }

    public static PoolSettings defaults() {
        return new PoolSettings(8, Duration.ofSeconds(5), Duration.ofMinutes(5));
    }

    public PoolSettings withMaxSize(int newMaxSize) {
        return new PoolSettings(newMaxSize, acquireTimeout, maxIdle);
    }
}
