package com.aiide.backbone.util;

import java.time.Duration;

public final class Durations {

    private Durations() {
    }

    /** Throws if {@code value} is null, zero or negative. */
    public static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
        return value;
    }

    /** Nanoseconds left until {@code deadline}, never negative. */
    public static long remainingNanos(long deadline, long now) {
        if (deadline == Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return Math.max(0L, deadline - now);
    }

    /** {@code now + timeout}, saturating at {@link Long#MAX_VALUE}. */
    public static long deadline(long now, Duration timeout) {
        long nanos;
        try {
            nanos = timeout.toNanos();
        } catch (ArithmeticException e) {
            nanos = Long.MAX_VALUE;
        }
        long deadline = now + nanos;
        return (deadline < now) ? Long.MAX_VALUE : deadline;
    }
}
