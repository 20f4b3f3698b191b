package com.aiide.backbone.core.health;

import com.aiide.backbone.core.service.LifecycleManager;
import com.aiide.backbone.core.service.ServiceDescriptor;
import com.aiide.backbone.core.service.ServiceState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import java.util.Map;

@Readiness
@ApplicationScoped
public class LifecycleReadinessCheck implements HealthCheck {

    @Inject
    LifecycleManager lifecycle;

    @Override
    public HealthCheckResponse call() {
        Map<String, ServiceState> status = lifecycle.status();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("services")
                .withData("manager", lifecycle.managerState().name());
        status.forEach((name, state) -> builder.withData(name, state.name()));

        boolean up = lifecycle.isAccepting();
        for (ServiceDescriptor<?> descriptor : lifecycle.descriptors()) {
            if (!descriptor.optional() && status.get(descriptor.name()) != ServiceState.READY) {
                up = false;
            }
        }
        return builder.status(up).build();
    }
}
