package com.aiide.backbone.core.task;

import com.aiide.backbone.core.BackboneException;

/**
 * Thrown by {@link CancellationToken#checkpoint()} once cancellation has been
 * requested, and by {@link TaskHandle#join} for a task that ended cancelled.
 */
public class TaskCancelledException extends BackboneException {

    public TaskCancelledException(String message) {
        super(message);
    }
}
