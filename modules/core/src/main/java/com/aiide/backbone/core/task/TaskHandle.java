package com.aiide.backbone.core.task;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller-side view of a spawned task. The future completes only after the
 * task's cleanup has run.
 */
public class TaskHandle {

    private final SupervisedTask task;
    private final TaskSupervisor supervisor;

    TaskHandle(SupervisedTask task, TaskSupervisor supervisor) {
        this.task = task;
        this.supervisor = supervisor;
    }

    public long taskId() {
        return task.id();
    }

    public String name() {
        return task.name();
    }

    public boolean isDone() {
        return task.done().isDone();
    }

    public TaskRecord snapshot() {
        return task.snapshot();
    }

    /** Waits for the task and its cleanup to finish and returns the final record. */
    public TaskRecord await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return task.done().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task record future failed", e.getCause());
        }
    }

    /**
     * Like {@link #await} but turns a failed or cancelled outcome into an exception.
     *
     * @throws TaskFailedException    if the body threw
     * @throws TaskCancelledException if the task was cancelled
     */
    public TaskRecord join(Duration timeout) throws InterruptedException, TimeoutException {
        TaskRecord record = await(timeout);
        switch (record.status()) {
            case FAILED:
                throw new TaskFailedException(record);
            case CANCELLED:
                throw new TaskCancelledException("Task " + record.id() + " (" + record.name() + ") was cancelled");
            default:
                return record;
        }
    }

    /** @see TaskSupervisor#cancel(long) */
    public boolean cancel() {
        return supervisor.cancel(task.id());
    }
}
