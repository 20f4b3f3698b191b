package com.aiide.backbone.core.cache;

import com.aiide.backbone.core.event.EventBus;
import com.aiide.backbone.core.event.EventKind;
import com.aiide.backbone.util.Ticker;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Namespaced caches. Each namespace is an independent {@link TtlLruCache}
 * created on first use; evictions are announced as
 * {@link EventKind#CACHE_EVICTED} with subject {@code namespace:key}.
 */
public class CacheManager {

    private static final Logger log = Logger.getLogger(CacheManager.class);

    private final CacheSettings defaults;
    private final Ticker ticker;
    private final EventBus events;
    private final Map<String, CacheSettings> overrides = new ConcurrentHashMap<>();
    private final Map<String, TtlLruCache<Object, Object>> namespaces = new ConcurrentHashMap<>();

    public CacheManager(CacheSettings defaults, Ticker ticker, EventBus events) {
        this.defaults = defaults;
        this.ticker = ticker;
        this.events = events;
    }

    /**
     * Sets the bounds for a namespace. Must be called before the namespace is
     * first used.
     */
    public void configure(String namespace, CacheSettings settings) {
        if (namespaces.containsKey(namespace)) {
            throw new IllegalStateException("Cache namespace already in use: " + namespace);
        }
        overrides.put(namespace, settings);
    }

    @SuppressWarnings("unchecked")
    public <K, V> TtlLruCache<K, V> namespace(String namespace) {
        return (TtlLruCache<K, V>) (TtlLruCache<?, ?>) namespaces.computeIfAbsent(namespace, this::create);
    }

    @SuppressWarnings("unchecked")
    public <V> Optional<V> get(String namespace, Object key) {
        return (Optional<V>) namespace(namespace).get(key);
    }

    public void put(String namespace, Object key, Object value) {
        namespace(namespace).put(key, value);
    }

    public void put(String namespace, Object key, Object value, Duration ttl) {
        namespace(namespace).put(key, value, ttl);
    }

    public boolean invalidate(String namespace, Object key) {
        TtlLruCache<Object, Object> cache = namespaces.get(namespace);
        return cache != null && cache.invalidate(key);
    }

    public int purgeExpired() {
        int total = 0;
        for (TtlLruCache<Object, Object> cache : namespaces.values()) {
            total += cache.purgeExpired();
        }
        if (total > 0) {
            log.debugf("Cache sweep reclaimed %d expired entries", total);
        }
        return total;
    }

    public int invalidateAll() {
        int total = 0;
        for (TtlLruCache<Object, Object> cache : namespaces.values()) {
            total += cache.invalidateAll();
        }
        return total;
    }

    public List<CacheStats> stats() {
        List<CacheStats> stats = new ArrayList<>();
        for (TtlLruCache<Object, Object> cache : namespaces.values()) {
            stats.add(cache.stats());
        }
        stats.sort(Comparator.comparing(CacheStats::name));
        return stats;
    }

    private TtlLruCache<Object, Object> create(String namespace) {
        CacheSettings settings = overrides.getOrDefault(namespace, defaults);
        log.debugf("Creating cache namespace '%s' (maxEntries=%d, maxBytes=%d, ttl=%s)",
                namespace, settings.maxEntries(), settings.maxBytes(), settings.defaultTtl());
        return new TtlLruCache<>(namespace, settings, ticker, Weigher.approximate(),
                (key, value, cause) -> {
                    if (cause.isEviction()) {
                        events.publish(EventKind.CACHE_EVICTED, namespace + ":" + key, cause.name());
                    }
                });
    }
}
