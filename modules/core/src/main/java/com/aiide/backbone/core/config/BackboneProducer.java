package com.aiide.backbone.core.config;

import com.aiide.backbone.core.cache.CacheManager;
import com.aiide.backbone.core.cache.CacheSettings;
import com.aiide.backbone.core.event.EventBus;
import com.aiide.backbone.core.pool.PoolRegistry;
import com.aiide.backbone.core.pool.PoolSettings;
import com.aiide.backbone.core.ratelimit.RateLimitSettings;
import com.aiide.backbone.core.ratelimit.RateLimiter;
import com.aiide.backbone.core.service.LifecycleManager;
import com.aiide.backbone.core.service.LifecycleSettings;
import com.aiide.backbone.core.task.TaskSettings;
import com.aiide.backbone.core.task.TaskSupervisor;
import com.aiide.backbone.util.Ticker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

/**
 * Builds the shared backbone components once from configuration. The
 * {@link LifecycleManager} owns the others and tears them down on shutdown.
 */
@ApplicationScoped
public class BackboneProducer {

    @ConfigProperty(name = "backbone.pool.max-size", defaultValue = "8")
    int poolMaxSize;

    @ConfigProperty(name = "backbone.pool.acquire-timeout", defaultValue = "5s")
    Duration poolAcquireTimeout;

    @ConfigProperty(name = "backbone.pool.max-idle", defaultValue = "5m")
    Duration poolMaxIdle;

    @ConfigProperty(name = "backbone.cache.max-entries", defaultValue = "1000")
    int cacheMaxEntries;

    @ConfigProperty(name = "backbone.cache.max-bytes", defaultValue = "52428800")
    long cacheMaxBytes;

    @ConfigProperty(name = "backbone.cache.default-ttl", defaultValue = "5m")
    Duration cacheDefaultTtl;

    @ConfigProperty(name = "backbone.rate-limit.rate-per-second", defaultValue = "10")
    double ratePerSecond;

    @ConfigProperty(name = "backbone.rate-limit.burst", defaultValue = "20")
    int rateBurst;

    @ConfigProperty(name = "backbone.tasks.shutdown-grace-timeout", defaultValue = "10s")
    Duration shutdownGraceTimeout;

    @ConfigProperty(name = "backbone.tasks.history-size", defaultValue = "256")
    int taskHistorySize;

    @ConfigProperty(name = "backbone.lifecycle.phase-timeout", defaultValue = "30s")
    Duration phaseTimeout;

    @ConfigProperty(name = "backbone.lifecycle.init-timeout", defaultValue = "30s")
    Duration initTimeout;

    @Produces
    @Singleton
    public EventBus eventBus() {
        return new EventBus();
    }

    @Produces
    @Singleton
    public PoolRegistry poolRegistry(EventBus events) {
        return new PoolRegistry(new PoolSettings(poolMaxSize, poolAcquireTimeout, poolMaxIdle),
                Ticker.system(), events);
    }

    @Produces
    @Singleton
    public CacheManager cacheManager(EventBus events) {
        return new CacheManager(new CacheSettings(cacheMaxEntries, cacheMaxBytes, cacheDefaultTtl),
                Ticker.system(), events);
    }

    @Produces
    @Singleton
    public RateLimiter rateLimiter(EventBus events) {
        return new RateLimiter(new RateLimitSettings(ratePerSecond, rateBurst), Ticker.system(), events);
    }

    @Produces
    @Singleton
    public TaskSupervisor taskSupervisor(EventBus events) {
        return new TaskSupervisor(new TaskSettings(shutdownGraceTimeout, taskHistorySize), events);
    }

    @Produces
    @Singleton
    public LifecycleManager lifecycleManager(EventBus events, TaskSupervisor tasks, PoolRegistry pools,
                                             CacheManager caches, RateLimiter rateLimiter) {
        return new LifecycleManager(new LifecycleSettings(phaseTimeout, initTimeout),
                events, tasks, pools, caches, rateLimiter);
    }
}
