package com.iksanov.respcache.server.core;

import com.iksanov.respcache.server.metrics.CacheMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory store with lazy and active expiry.
 * <p>
 * Each mutation is a single atomic {@link ConcurrentHashMap} operation on one key:
 *  - {@code set} replaces the whole entry with {@code put}
 *  - {@code get} checks and evicts inside {@code computeIfPresent}
 *  - {@code removeExpired} uses {@code remove(key, entry)}, so an entry installed by a
 *    concurrent {@code set} is never deleted by a sweep that saw the old one
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);
    private final ConcurrentMap<CacheKey, CacheEntry> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final CacheMetrics metrics;

    public InMemoryCacheStore() {
        this(Clock.systemUTC(), new CacheMetrics());
    }

    public InMemoryCacheStore(CacheMetrics metrics) {
        this(Clock.systemUTC(), metrics);
    }

    public InMemoryCacheStore(Clock clock, CacheMetrics metrics) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        log.info("InMemoryCacheStore initialized (clock={})", clock);
    }

    @Override
    public void set(byte[] key, byte[] value) {
        put(key, value, CacheEntry.NO_EXPIRY);
    }

    @Override
    public void set(byte[] key, byte[] value, long ttlMillis) {
        if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
        long now = clock.millis();
        long expireAt = ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
        put(key, value, expireAt);
    }

    private void put(byte[] key, byte[] value, long expireAt) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Timer.Sample sample = metrics.startTimer();
        try {
            store.put(CacheKey.of(key), new CacheEntry(value.clone(), expireAt));
        } finally {
            metrics.stopSetTimer(sample);
            metrics.updateSize(store.size());
        }
    }

    @Override
    public byte[] get(byte[] key) {
        Objects.requireNonNull(key, "key");
        Timer.Sample sample = metrics.startTimer();
        try {
            CacheKey cacheKey = CacheKey.of(key);
            boolean[] evicted = new boolean[1];
            CacheEntry entry = store.computeIfPresent(cacheKey, (k, current) -> {
                if (current.isExpired(clock.millis())) {
                    evicted[0] = true;
                    return null;
                }
                return current;
            });

            if (evicted[0]) {
                metrics.recordLazyExpiration();
                log.trace("GET evicted expired key={}", cacheKey);
            }
            if (entry == null) {
                metrics.recordMiss();
                return null;
            }
            metrics.recordHit();
            return entry.value.clone();
        } finally {
            metrics.stopGetTimer(sample);
            metrics.updateSize(store.size());
        }
    }

    @Override
    public int removeExpired() {
        long now = clock.millis();
        int removed = 0;
        Iterator<Map.Entry<CacheKey, CacheEntry>> iterator = store.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<CacheKey, CacheEntry> e = iterator.next();
            CacheEntry entry = e.getValue();
            if (entry.isExpired(now) && store.remove(e.getKey(), entry)) removed++;
        }
        if (removed > 0) {
            metrics.recordReaperExpirations(removed);
            metrics.updateSize(store.size());
            log.debug("Expiry sweep removed {} entries, size now {}", removed, store.size());
        }
        return removed;
    }

    @Override
    public int size() {
        return store.size();
    }

    @Override
    public void clear() {
        store.clear();
        metrics.updateSize(0);
        log.info("Cache cleared");
    }
}
