package com.aiide.backbone.core.health;

import com.aiide.backbone.core.task.TaskRecord;
import com.aiide.backbone.core.task.TaskStatus;
import com.aiide.backbone.core.task.TaskSupervisor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

@Liveness
@ApplicationScoped
public class TaskLivenessCheck implements HealthCheck {

    @Inject
    TaskSupervisor tasks;

    @Override
    public HealthCheckResponse call() {
        long failed = 0;
        long leaked = 0;
        for (TaskRecord record : tasks.finishedTasks()) {
            if (record.status() == TaskStatus.FAILED) failed++;
            if (record.status() == TaskStatus.LEAKED) leaked++;
        }
        return HealthCheckResponse.named("tasks")
                .up()
                .withData("running", tasks.activeCount())
                .withData("recentlyFailed", failed)
                .withData("leaked", leaked)
                .build();
    }
}
