package com.aiide.backbone.core.pool;

public record PoolStats(
        String name,
        int maxSize,
        int idle,
        int leased,
        long created,
        long destroyed,
        long acquired,
        long timeouts
) {}
