package com.aiide.backbone.core.task;

@FunctionalInterface
public interface TaskBody {

    void run(CancellationToken token) throws Exception;
}
