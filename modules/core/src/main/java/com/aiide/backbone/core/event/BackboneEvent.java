package com.aiide.backbone.core.event;

import java.time.Instant;
import java.util.Objects;

/**
 * A state transition announced on the {@link EventBus}.
 *
 * @param kind      what happened
 * @param subject   service name, cache key, pool name, rate-limit key or task name
 * @param timestamp when the publisher observed the transition
 * @param detail    human readable detail, never null
 */
public record BackboneEvent(
        EventKind kind,
        String subject,
        Instant timestamp,
        String detail
) {
    public BackboneEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(timestamp, "timestamp");
        detail = (detail == null) ? "" : detail;
    }

    public static BackboneEvent of(EventKind kind, String subject, String detail) {
        return new BackboneEvent(kind, subject, Instant.now(), detail);
    }
}
