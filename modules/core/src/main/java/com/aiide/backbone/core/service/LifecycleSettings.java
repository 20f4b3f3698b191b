package com.aiide.backbone.core.service;

import com.aiide.backbone.util.Durations;

import java.time.Duration;

/**
 * @param phaseTimeout how long {@link LifecycleManager#startAll()} waits for one phase
 * @param initTimeout  default wait in {@link LifecycleManager#getService} for a service
 *                     another caller is constructing
 */
public record LifecycleSettings(Duration phaseTimeout, Duration initTimeout) {

    public LifecycleSettings {
        Durations.requirePositive(phaseTimeout, "phaseTimeout");
        Durations.requirePositive(initTimeout, "initTimeout");
    }

    public static LifecycleSettings defaults() {
        return new LifecycleSettings(Duration.ofSeconds(30), Duration.ofSeconds(30));
    }
}
