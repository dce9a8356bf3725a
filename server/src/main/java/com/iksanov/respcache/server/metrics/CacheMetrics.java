package com.iksanov.respcache.server.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics collector for the key-value store using Micrometer.
 * Exposes hit/miss, expiry and latency statistics to Prometheus.
 */
public class CacheMetrics {

    private final PrometheusMeterRegistry registry;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter lazyExpirations;
    private final Counter reaperExpirations;
    private final Timer getLatency;
    private final Timer setLatency;
    private final AtomicLong cacheSize = new AtomicLong(0);

    public CacheMetrics() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.cacheHits = Counter.builder("cache.hits")
                .description("Number of GETs that found a live key")
                .register(registry);

        this.cacheMisses = Counter.builder("cache.misses")
                .description("Number of GETs that found no live key")
                .register(registry);

        this.lazyExpirations = Counter.builder("cache.expirations")
                .tag("source", "lazy")
                .description("Expired entries removed on read")
                .register(registry);

        this.reaperExpirations = Counter.builder("cache.expirations")
                .tag("source", "reaper")
                .description("Expired entries removed by the background reaper")
                .register(registry);

        this.getLatency = Timer.builder("cache.get.duration")
                .description("GET operation duration")
                .serviceLevelObjectives(Duration.ofNanos(10_000), Duration.ofNanos(100_000), Duration.ofMillis(1))
                .register(registry);

        this.setLatency = Timer.builder("cache.set.duration")
                .description("SET operation duration")
                .serviceLevelObjectives(Duration.ofNanos(10_000), Duration.ofNanos(100_000), Duration.ofMillis(1))
                .register(registry);

        Gauge.builder("cache.size", cacheSize, AtomicLong::get)
                .description("Current number of physically stored entries")
                .register(registry);

        Gauge.builder("cache.hit.rate", this, CacheMetrics::calculateHitRate)
                .description("Cache hit rate percentage")
                .register(registry);
    }

    public void recordHit() {
        cacheHits.increment();
    }

    public void recordMiss() {
        cacheMisses.increment();
    }

    public void recordLazyExpiration() {
        lazyExpirations.increment();
    }

    public void recordReaperExpirations(int count) {
        if (count > 0) reaperExpirations.increment(count);
    }

    public void updateSize(int size) {
        cacheSize.set(size);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopGetTimer(Timer.Sample sample) {
        sample.stop(getLatency);
    }

    public void stopSetTimer(Timer.Sample sample) {
        sample.stop(setLatency);
    }

    public double hits() {
        return cacheHits.count();
    }

    public double misses() {
        return cacheMisses.count();
    }

    public double expirations() {
        return lazyExpirations.count() + reaperExpirations.count();
    }

    private double calculateHitRate() {
        double hits = cacheHits.count();
        double misses = cacheMisses.count();
        double total = hits + misses;
        return total == 0 ? 0.0 : (hits / total) * 100.0;
    }

    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
