package com.aiide.backbone.core.maintenance;

import com.aiide.backbone.core.cache.CacheManager;
import com.aiide.backbone.core.pool.PoolRegistry;
import com.aiide.backbone.core.ratelimit.RateLimiter;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Periodic sweep: expired cache entries, pool entries idle past their limit,
 * and rate-limit buckets nobody has used for a while.
 */
@ApplicationScoped
public class MaintenanceScheduler {

    private static final Logger log = Logger.getLogger(MaintenanceScheduler.class);

    @Inject
    CacheManager caches;

    @Inject
    PoolRegistry pools;

    @Inject
    RateLimiter rateLimiter;

    @ConfigProperty(name = "backbone.rate-limit.idle-bucket-expiry", defaultValue = "10m")
    Duration idleBucketExpiry;

    @Scheduled(every = "${backbone.maintenance.interval:30s}", concurrentExecution = SKIP)
    public void sweep() {
        int expired = caches.purgeExpired();
        int evicted = pools.evictIdle();
        int buckets = rateLimiter.removeIdleBuckets(idleBucketExpiry);
        if (expired + evicted + buckets > 0) {
            log.debugf("Maintenance: %d expired cache entries, %d idle pool entries, %d idle rate-limit buckets",
                    expired, evicted, buckets);
        }
    }
}
