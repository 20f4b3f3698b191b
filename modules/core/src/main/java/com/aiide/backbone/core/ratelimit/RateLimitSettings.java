package com.aiide.backbone.core.ratelimit;

/**
 * @param ratePerSecond tokens added per second, continuously
 * @param burst         bucket capacity, also the number of calls admitted back to back from full
 */
public record RateLimitSettings(double ratePerSecond, int burst) {

    public RateLimitSettings {
        if (!(ratePerSecond > 0) || Double.isInfinite(ratePerSecond)) {
            throw new IllegalArgumentException("ratePerSecond must be positive, was " + ratePerSecond);
        }
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be at least 1, was " + burst);
        }
    }

    public static RateLimitSettings defaults() {
        return new RateLimitSettings(10.0, 20);
    }
}
