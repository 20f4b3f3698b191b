package com.aiide.backbone.core.ratelimit;

import java.time.Duration;

/**
 * Token bucket for one key. Starts full, refills continuously at
 * {@code ratePerSecond} up to {@code burst}. All methods are synchronized on
 * the bucket, so buckets for different keys never contend.
 * <p>
 * A retired bucket has been dropped from the limiter and grants nothing;
 * callers holding it look the key up again.
 */
final class TokenBucket {

    enum Admission { GRANTED, DENIED, RETIRED }

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;
    // absorbs floating point drift so that waiting exactly 1/rate yields one token
    private static final double EPSILON = 1e-9;

    private final String key;
    private final RateLimitSettings settings;
    private double tokens;
    private long lastRefill;
    private long lastAccess;
    private boolean retired;

    TokenBucket(String key, RateLimitSettings settings, long now) {
        this.key = key;
        this.settings = settings;
        this.tokens = settings.burst();
        this.lastRefill = now;
        this.lastAccess = now;
    }

    synchronized Admission tryConsume(int permits, long now) {
        if (retired) {
            return Admission.RETIRED;
        }
        refill(now);
        lastAccess = now;
        if (tokens + EPSILON >= permits) {
            tokens = Math.max(0.0, tokens - permits);
            return Admission.GRANTED;
        }
        return Admission.DENIED;
    }

    synchronized Duration timeUntil(int permits, long now) {
        refill(now);
        double missing = permits - tokens;
        if (missing <= EPSILON) {
            return Duration.ZERO;
        }
        return Duration.ofNanos((long) Math.ceil(missing / settings.ratePerSecond() * NANOS_PER_SECOND));
    }

    synchronized double available(long now) {
        refill(now);
        return tokens;
    }

    /** Retires the bucket if it was untouched for {@code nanos} and has refilled completely. */
    synchronized boolean retireIfIdle(long nanos, long now) {
        refill(now);
        if (!retired && now - lastAccess >= nanos && tokens + EPSILON >= settings.burst()) {
            retired = true;
        }
        return retired;
    }

    String key() {
        return key;
    }

    RateLimitSettings settings() {
        return settings;
    }

    private void refill(long now) {
        long elapsed = now - lastRefill;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(settings.burst(), tokens + elapsed * settings.ratePerSecond() / NANOS_PER_SECOND);
        lastRefill = now;
    }
}
