package com.aiide.backbone.core.cache;

import com.aiide.backbone.util.Durations;
import com.aiide.backbone.util.Ticker;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded key/value store with per-entry TTL and least-recently-used size eviction.
 * <p>
 * Expiry is absolute: insertion time plus TTL. A read refreshes the entry's
 * LRU position but never its expiry. An entry is a hit strictly before its
 * expiry instant and a miss from that instant on, whether the read or the
 * periodic {@link #purgeExpired()} sweep reclaims it. Entry count never
 * exceeds {@code maxEntries} and total weight never exceeds {@code maxBytes}
 * once a mutating call returns.
 * <p>
 * All map access happens under one lock with short critical sections. Removal
 * notifications, including closing {@link AutoCloseable} values, run after the
 * lock is released but before the mutating call returns.
 */
public class TtlLruCache<K, V> {

    private static final Logger log = Logger.getLogger(TtlLruCache.class);

    private final String name;
    private final CacheSettings settings;
    private final Ticker ticker;
    private final Weigher<? super K, ? super V> weigher;
    private final RemovalListener<? super K, ? super V> removalListener;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, CacheEntry<V>> entries = new LinkedHashMap<>(16, 0.75f, true);

    // guarded by lock
    private long totalWeight;
    private long hits;
    private long misses;
    private long puts;
    private long expired;
    private long evictedBySize;
    private long invalidated;

    public TtlLruCache(String name, CacheSettings settings, Ticker ticker,
                       Weigher<? super K, ? super V> weigher,
                       RemovalListener<? super K, ? super V> removalListener) {
        this.name = Objects.requireNonNull(name, "name");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.weigher = Objects.requireNonNull(weigher, "weigher");
        this.removalListener = Objects.requireNonNull(removalListener, "removalListener");
    }

    public TtlLruCache(String name, CacheSettings settings, Ticker ticker) {
        this(name, settings, ticker, Weigher.approximate(), (k, v, c) -> { });
    }

    public String name() {
        return name;
    }

    public CacheSettings settings() {
        return settings;
    }

    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key");
        List<Removal<K, V>> removed = null;
        V result = null;
        long now = ticker.nanos();
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
            } else if (entry.isExpired(now)) {
                entries.remove(key);
                totalWeight -= entry.weight();
                misses++;
                expired++;
                removed = List.of(new Removal<>(key, entry.value(), RemovalCause.EXPIRED));
            } else {
                hits++;
                result = entry.value();
            }
        } finally {
            lock.unlock();
        }
        notifyRemovals(removed);
        return Optional.ofNullable(result);
    }

    public void put(K key, V value) {
        put(key, value, settings.defaultTtl());
    }

    /**
     * Stores {@code value} until {@code ttl} elapses. Last write wins. A value
     * heavier than {@code maxBytes} is not stored, and any previous value for
     * the key is removed.
     */
    public void put(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Durations.requirePositive(ttl, "ttl");

        long weight = Math.max(0L, weigher.weigh(key, value));
        long now = ticker.nanos();
        CacheEntry<V> fresh = new CacheEntry<>(value, now, Durations.deadline(now, ttl), weight);
        List<Removal<K, V>> removed = new ArrayList<>();

        lock.lock();
        try {
            puts++;
            CacheEntry<V> previous;
            if (weight > settings.maxBytes()) {
                previous = entries.remove(key);
                log.debugf("Cache '%s': value for %s weighs %d bytes, over the %d byte bound; not stored",
                        name, key, weight, settings.maxBytes());
            } else {
                previous = entries.put(key, fresh);
                totalWeight += weight;
            }
            if (previous != null) {
                totalWeight -= previous.weight();
                if (previous.value() != value) {
                    removed.add(new Removal<>(key, previous.value(), RemovalCause.REPLACED));
                }
            }
            evictToBounds(now, removed);
        } finally {
            lock.unlock();
        }
        notifyRemovals(removed);
    }

    public boolean invalidate(K key) {
        Objects.requireNonNull(key, "key");
        CacheEntry<V> entry;
        lock.lock();
        try {
            entry = entries.remove(key);
            if (entry != null) {
                totalWeight -= entry.weight();
                invalidated++;
            }
        } finally {
            lock.unlock();
        }
        if (entry == null) {
            return false;
        }
        notifyRemovals(List.of(new Removal<>(key, entry.value(), RemovalCause.EXPLICIT)));
        return true;
    }

    public int invalidateAll() {
        List<Removal<K, V>> removed = new ArrayList<>();
        lock.lock();
        try {
            for (Map.Entry<K, CacheEntry<V>> e : entries.entrySet()) {
                removed.add(new Removal<>(e.getKey(), e.getValue().value(), RemovalCause.EXPLICIT));
            }
            invalidated += entries.size();
            entries.clear();
            totalWeight = 0;
        } finally {
            lock.unlock();
        }
        notifyRemovals(removed);
        return removed.size();
    }

    /**
     * Sweep path: drops every expired entry.
     *
     * @return number of entries reclaimed
     */
    public int purgeExpired() {
        List<Removal<K, V>> removed = new ArrayList<>();
        long now = ticker.nanos();
        lock.lock();
        try {
            Iterator<Map.Entry<K, CacheEntry<V>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<K, CacheEntry<V>> e = it.next();
                if (e.getValue().isExpired(now)) {
                    it.remove();
                    totalWeight -= e.getValue().weight();
                    expired++;
                    removed.add(new Removal<>(e.getKey(), e.getValue().value(), RemovalCause.EXPIRED));
                }
            }
        } finally {
            lock.unlock();
        }
        notifyRemovals(removed);
        return removed.size();
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public long weight() {
        lock.lock();
        try {
            return totalWeight;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(name, entries.size(), totalWeight, hits, misses, puts,
                    expired, evictedBySize, invalidated);
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private void evictToBounds(long now, List<Removal<K, V>> removed) {
        Iterator<Map.Entry<K, CacheEntry<V>>> it = entries.entrySet().iterator();
        while ((entries.size() > settings.maxEntries() || totalWeight > settings.maxBytes()) && it.hasNext()) {
            Map.Entry<K, CacheEntry<V>> eldest = it.next();
            it.remove();
            CacheEntry<V> entry = eldest.getValue();
            totalWeight -= entry.weight();
            RemovalCause cause;
            if (entry.isExpired(now)) {
                cause = RemovalCause.EXPIRED;
                expired++;
            } else {
                cause = RemovalCause.SIZE;
                evictedBySize++;
            }
            removed.add(new Removal<>(eldest.getKey(), entry.value(), cause));
        }
    }

    private void notifyRemovals(List<Removal<K, V>> removed) {
        if (removed == null) {
            return;
        }
        for (Removal<K, V> r : removed) {
            try {
                removalListener.onRemoval(r.key(), r.value(), r.cause());
            } catch (RuntimeException e) {
                log.warnf(e, "Cache '%s': removal listener failed for %s", name, r.key());
            }
            release(r);
        }
    }

    private void release(Removal<K, V> r) {
        if (r.value() instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warnf(e, "Cache '%s': error releasing value for %s", name, r.key());
            }
        }
    }

    private record Removal<K, V>(K key, V value, RemovalCause cause) {}
}
