package com.aiide.backbone.util;

/**
 * Monotonic nanosecond time source.
 * <p>
 * Every time-based component (cache expiry, token refill, pool idle ages) reads
 * time through a {@code Ticker} so that tests can drive the clock by hand.
 */
@FunctionalInterface
public interface Ticker {

    long nanos();

    static Ticker system() {
        return System::nanoTime;
    }
}
