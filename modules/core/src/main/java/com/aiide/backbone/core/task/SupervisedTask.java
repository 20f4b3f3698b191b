package com.aiide.backbone.core.task;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Live bookkeeping for a running task. The worker thread reference is only
 * touched under this object's monitor, so a cancel never interrupts a thread
 * that has already moved on to cleanup or to another task.
 */
final class SupervisedTask {

    private final long id;
    private final String name;
    private final String scope;
    private final CancellationToken token;
    private final TaskCleanup cleanup;
    private final Instant startedAt = Instant.now();
    private final CompletableFuture<TaskRecord> done = new CompletableFuture<>();

    private Thread worker;
    private volatile TaskStatus status = TaskStatus.RUNNING;
    private volatile TaskError error;
    private volatile Instant finishedAt;

    SupervisedTask(long id, String name, String scope, CancellationToken token, TaskCleanup cleanup) {
        this.id = id;
        this.name = name;
        this.scope = scope;
        this.token = token;
        this.cleanup = cleanup;
    }

    long id() {
        return id;
    }

    String name() {
        return name;
    }

    String scope() {
        return scope;
    }

    CancellationToken token() {
        return token;
    }

    TaskCleanup cleanup() {
        return cleanup;
    }

    CompletableFuture<TaskRecord> done() {
        return done;
    }

    synchronized void bind(Thread thread) {
        worker = thread;
    }

    synchronized void unbind() {
        worker = null;
    }

    synchronized boolean runsOn(Thread thread) {
        return worker == thread;
    }

    /** Cooperative wake-up for tasks blocked in interruptible calls. */
    synchronized void interrupt() {
        if (worker != null) {
            worker.interrupt();
        }
    }

    void finish(TaskStatus outcome, TaskError failure) {
        this.error = failure;
        this.finishedAt = Instant.now();
        this.status = outcome;
    }

    void markLeaked() {
        if (!done.isDone()) {
            status = TaskStatus.LEAKED;
        }
    }

    TaskRecord snapshot() {
        return new TaskRecord(id, name, scope, status, token.isCancelled(), startedAt, finishedAt, error);
    }
}
