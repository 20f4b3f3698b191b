package com.aiide.backbone.core.task;

/**
 * Runs exactly once when a task ends, whatever the outcome. Receives the
 * final record so it can tell success from failure or cancellation.
 */
@FunctionalInterface
public interface TaskCleanup {

    TaskCleanup NONE = record -> { };

    void cleanup(TaskRecord record) throws Exception;
}
