package com.aiide.backbone.core.ratelimit;

import com.aiide.backbone.core.event.EventBus;
import com.aiide.backbone.core.event.EventKind;
import com.aiide.backbone.util.Ticker;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key token-bucket admission control. {@link #tryAcquire} never blocks;
 * callers needing backpressure combine it with their own retry policy.
 * <p>
 * Key prefixes can carry their own rate (for example {@code "ai:"} for model
 * calls); the longest matching prefix wins. Overrides apply to buckets created
 * after they are registered.
 */
public class RateLimiter {

    private static final Logger log = Logger.getLogger(RateLimiter.class);

    private final RateLimitSettings defaults;
    private final Ticker ticker;
    private final EventBus events;
    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final Map<String, RateLimitSettings> overrides = new ConcurrentHashMap<>();

    public RateLimiter(RateLimitSettings defaults, Ticker ticker, EventBus events) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.events = Objects.requireNonNull(events, "events");
    }

    public void override(String keyPrefix, RateLimitSettings settings) {
        overrides.put(Objects.requireNonNull(keyPrefix, "keyPrefix"), Objects.requireNonNull(settings, "settings"));
    }

    public boolean tryAcquire(String key) {
        return tryAcquire(key, 1);
    }

    public boolean tryAcquire(String key, int permits) {
        if (permits < 1) {
            throw new IllegalArgumentException("permits must be at least 1, was " + permits);
        }
        TokenBucket.Admission admission;
        do {
            TokenBucket bucket = bucket(key);
            if (permits > bucket.settings().burst()) {
                throw new IllegalArgumentException("permits " + permits + " exceed burst "
                        + bucket.settings().burst() + " for '" + key + "'");
            }
            admission = bucket.tryConsume(permits, ticker.nanos());
            // RETIRED: removed as idle after we looked it up; retry on the replacement
        } while (admission == TokenBucket.Admission.RETIRED);

        if (admission == TokenBucket.Admission.DENIED) {
            log.debugf("Rate limited: %s", key);
            events.publish(EventKind.RATE_LIMITED, key, "permits=" + permits);
            return false;
        }
        return true;
    }

    /**
     * Like {@link #tryAcquire(String)} but throws on denial.
     *
     * @throws RateLimitedException with the time until a token is available
     */
    public void checkAdmission(String key) {
        if (!tryAcquire(key)) {
            throw new RateLimitedException(key, retryAfter(key));
        }
    }

    public Duration retryAfter(String key) {
        return bucket(key).timeUntil(1, ticker.nanos());
    }

    public double availableTokens(String key) {
        return bucket(key).available(ticker.nanos());
    }

    public RateLimitSettings settingsFor(String key) {
        RateLimitSettings best = defaults;
        int bestLength = -1;
        for (Map.Entry<String, RateLimitSettings> e : overrides.entrySet()) {
            String prefix = e.getKey();
            if (key.startsWith(prefix) && prefix.length() > bestLength) {
                best = e.getValue();
                bestLength = prefix.length();
            }
        }
        return best;
    }

    /**
     * Drops buckets not touched for {@code idle}. A dropped key starts again
     * from a full bucket, which is what an idle key would have refilled to.
     */
    public int removeIdleBuckets(Duration idle) {
        long now = ticker.nanos();
        long idleNanos = idle.toNanos();
        int removed = 0;
        for (Map.Entry<String, TokenBucket> e : buckets.entrySet()) {
            TokenBucket bucket = e.getValue();
            if (bucket.retireIfIdle(idleNanos, now) && buckets.remove(e.getKey(), bucket)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debugf("Removed %d idle rate-limit buckets", removed);
        }
        return removed;
    }

    public int bucketCount() {
        return buckets.size();
    }

    private TokenBucket bucket(String key) {
        Objects.requireNonNull(key, "key");
        return buckets.computeIfAbsent(key, k -> new TokenBucket(k, settingsFor(k), ticker.nanos()));
    }
}
