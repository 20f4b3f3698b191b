package com.aiide.backbone.core.task;

import java.util.Objects;

/**
 * Spawn builder. {@code start} only exists on the object returned by
 * {@link #cleanup(TaskCleanup)}, so a task cannot be started without one:
 * <pre>
 * supervisor.task("index-workspace")
 *         .scope("lsp")
 *         .cleanup(record -> index.close())
 *         .start(token -> index.build(token));
 * </pre>
 */
public final class TaskBuilder {

    private final TaskSupervisor supervisor;
    private final String name;
    private String scope = TaskSupervisor.DEFAULT_SCOPE;

    TaskBuilder(TaskSupervisor supervisor, String name) {
        this.supervisor = supervisor;
        this.name = Objects.requireNonNull(name, "name");
    }

    /** Groups the task with others torn down together, usually the owning service's name. */
    public TaskBuilder scope(String scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
        return this;
    }

    public Armed cleanup(TaskCleanup cleanup) {
        return new Armed(Objects.requireNonNull(cleanup, "cleanup"));
    }

    public final class Armed {

        private final TaskCleanup cleanup;

        private Armed(TaskCleanup cleanup) {
            this.cleanup = cleanup;
        }

        public TaskHandle start(TaskBody body) {
            return supervisor.start(name, scope, Objects.requireNonNull(body, "body"), cleanup);
        }
    }
}
