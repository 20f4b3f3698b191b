package com.aiide.backbone.core.task;

import java.time.Instant;

/**
 * Snapshot of a supervised task.
 *
 * @param finishedAt null while running
 * @param error      null unless {@link TaskStatus#FAILED}
 */
public record TaskRecord(
        long id,
        String name,
        String scope,
        TaskStatus status,
        boolean cancellationRequested,
        Instant startedAt,
        Instant finishedAt,
        TaskError error
) {}
