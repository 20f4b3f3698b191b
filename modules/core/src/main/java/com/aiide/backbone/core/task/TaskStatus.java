package com.aiide.backbone.core.task;

public enum TaskStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    /** Did not finish its cleanup within the shutdown grace period. */
    LEAKED
}
