package com.aiide.backbone.core.task;

/**
 * Cooperative cancellation signal. A task checks it at its own checkpoints;
 * nothing is ever stopped forcibly. A child token reports cancelled as soon
 * as any ancestor is cancelled.
 */
public final class CancellationToken {

    private final CancellationToken parent;
    private volatile boolean cancelled;

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public CancellationToken child() {
        return new CancellationToken(this);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    /** @throws TaskCancelledException if cancellation was requested */
    public void checkpoint() {
        if (isCancelled()) {
            throw new TaskCancelledException("Cancelled at checkpoint");
        }
    }
}
