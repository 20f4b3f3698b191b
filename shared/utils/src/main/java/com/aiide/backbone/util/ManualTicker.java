package com.aiide.backbone.util;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Ticker} that only moves when told to. Used by tests and by tools that
 * replay recorded timings.
 */
public class ManualTicker implements Ticker {

    private final AtomicLong nanos;

    public ManualTicker() {
        this(0L);
    }

    public ManualTicker(long startNanos) {
        this.nanos = new AtomicLong(startNanos);
    }

    @Override
    public long nanos() {
        return nanos.get();
    }

    public ManualTicker advance(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Ticker cannot move backwards: " + duration);
        }
        nanos.addAndGet(duration.toNanos());
        return this;
    }

    public ManualTicker advanceMillis(long millis) {
        return advance(Duration.ofMillis(millis));
    }
}
