package com.aiide.backbone.core.service;

import com.aiide.backbone.core.cache.CacheManager;
import com.aiide.backbone.core.event.EventBus;
import com.aiide.backbone.core.pool.PoolRegistry;
import com.aiide.backbone.core.ratelimit.RateLimiter;
import com.aiide.backbone.core.task.TaskBuilder;
import com.aiide.backbone.core.task.TaskSupervisor;

/**
 * What a {@link ServiceFactory} may use while building its service.
 */
public interface ServiceContext {

    String serviceName();

    /**
     * Returns a declared dependency, which is already {@link ServiceState#READY}.
     *
     * @throws IllegalArgumentException if {@code name} was not declared with
     *                                  {@link ServiceDescriptor.Builder#dependsOn}
     */
    <D> D dependency(String name, Class<D> type);

    PoolRegistry pools();

    CacheManager caches();

    RateLimiter rateLimiter();

    TaskSupervisor tasks();

    EventBus events();

    /** Starts building a background task scoped to this service; it is cancelled when the service stops. */
    TaskBuilder task(String taskName);
}
