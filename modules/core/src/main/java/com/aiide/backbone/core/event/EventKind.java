package com.aiide.backbone.core.event;

public enum EventKind {
    SERVICE_STATE_CHANGED,
    SERVICE_READY,
    SERVICE_FAILED,
    CACHE_EVICTED,
    POOL_EXHAUSTED,
    RATE_LIMITED,
    TASK_FAILED,
    TASK_CANCELLED,
    TASK_LEAKED
}
