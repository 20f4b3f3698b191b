package com.aiide.backbone.core.service;

import com.aiide.backbone.core.init.LazyOnce;

/**
 * {@code UNINITIALIZED -> INITIALIZING -> READY | FAILED -> SHUTTING_DOWN -> STOPPED}.
 * <p>
 * A retry of a failed service ({@code FAILED -> INITIALIZING}) takes two
 * published steps: {@link LifecycleManager#reset} moves it
 * {@code FAILED -> UNINITIALIZED}, and the next lookup or {@code startAll}
 * moves it {@code UNINITIALIZED -> INITIALIZING}. A failed service is never
 * retried without an explicit reset.
 */
public enum ServiceState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    FAILED,
    SHUTTING_DOWN,
    STOPPED;

    static ServiceState of(LazyOnce.State state) {
        switch (state) {
            case INITIALIZING:
                return INITIALIZING;
            case READY:
                return READY;
            case FAILED:
                return FAILED;
            default:
                return UNINITIALIZED;
        }
    }
}
