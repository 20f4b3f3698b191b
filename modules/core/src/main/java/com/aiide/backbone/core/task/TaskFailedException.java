package com.aiide.backbone.core.task;

import com.aiide.backbone.core.BackboneException;

public class TaskFailedException extends BackboneException {

    private final TaskRecord record;

    public TaskFailedException(TaskRecord record) {
        super("Task " + record.id() + " (" + record.name() + ") failed: "
                + (record.error() != null ? record.error().message() : "unknown error"));
        this.record = record;
    }

    public TaskRecord record() {
        return record;
    }
}
