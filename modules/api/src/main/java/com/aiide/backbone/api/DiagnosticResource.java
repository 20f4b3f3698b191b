package com.aiide.backbone.api;

import com.aiide.backbone.core.cache.CacheManager;
import com.aiide.backbone.core.cache.CacheStats;
import com.aiide.backbone.core.pool.PoolRegistry;
import com.aiide.backbone.core.pool.PoolStats;
import com.aiide.backbone.core.service.LifecycleManager;
import com.aiide.backbone.core.service.ServiceNotFoundException;
import com.aiide.backbone.core.service.ServiceState;
import com.aiide.backbone.core.task.TaskRecord;
import com.aiide.backbone.core.task.TaskSupervisor;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @Inject
    LifecycleManager lifecycle;

    @Inject
    PoolRegistry pools;

    @Inject
    CacheManager caches;

    @Inject
    TaskSupervisor tasks;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "Backbone is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, String> info() {
        return Map.of(
                "name", appName,
                "version", appVersion,
                "java", System.getProperty("java.version"),
                "profile", profile,
                "lifecycle", lifecycle.managerState().name()
        );
    }

    @GET
    @Path("/services")
    public Map<String, ServiceState> services() {
        return lifecycle.status();
    }

    @POST
    @Path("/services/{name}/reset")
    public Map<String, Object> reset(@PathParam("name") String name) {
        try {
            boolean reset = lifecycle.reset(name);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("service", name);
            result.put("reset", reset);
            result.put("state", lifecycle.state(name));
            return result;
        } catch (ServiceNotFoundException e) {
            throw new NotFoundException(e.getMessage(), e);
        }
    }

    @GET
    @Path("/pools")
    public List<PoolStats> pools() {
        return pools.stats();
    }

    @GET
    @Path("/caches")
    public List<CacheStats> caches() {
        return caches.stats();
    }

    @GET
    @Path("/tasks")
    public Map<String, List<TaskRecord>> tasks() {
        return Map.of(
                "active", tasks.activeTasks(),
                "finished", tasks.finishedTasks()
        );
    }
}
