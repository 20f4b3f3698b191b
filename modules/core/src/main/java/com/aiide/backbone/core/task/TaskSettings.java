package com.aiide.backbone.core.task;

import com.aiide.backbone.util.Durations;

import java.time.Duration;

/**
 * @param shutdownGraceTimeout how long cancel and shutdown wait for cleanups
 * @param historySize          finished records kept for diagnostics
 */
public record TaskSettings(Duration shutdownGraceTimeout, int historySize) {

    public TaskSettings {
        Durations.requirePositive(shutdownGraceTimeout, "shutdownGraceTimeout");
        if (historySize < 0) {
            throw new IllegalArgumentException("historySize must not be negative, was " + historySize);
        }
    }

    public static TaskSettings defaults() {
        return new TaskSettings(Duration.ofSeconds(10), 256);
    }
}
