package com.iksanov.respcache.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background task that periodically removes expired entries from a {@link CacheStore}.
 * <p>
 * Only bounds memory held by keys nobody reads again: reads never rely on it,
 * since {@link CacheStore#get(byte[])} evicts lazily.
 */
public class ExpiryReaper {

    private static final Logger log = LoggerFactory.getLogger(ExpiryReaper.class);
    private final CacheStore store;
    private final long intervalMillis;
    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public ExpiryReaper(CacheStore store, long intervalMillis) {
        if (intervalMillis <= 0) throw new IllegalArgumentException("intervalMillis must be > 0");
        this.store = Objects.requireNonNull(store, "store");
        this.intervalMillis = intervalMillis;
    }

    public synchronized void start() {
        if (running) {
            log.warn("ExpiryReaper already running");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("expiry-reaper");
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("Uncaught exception in reaper thread {}: {}", t.getName(), e.getMessage(), e)
            );
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        running = true;
        log.info("ExpiryReaper started (interval={}ms)", intervalMillis);
    }

    void sweep() {
        try {
            int removed = store.removeExpired();
            if (removed > 0) log.trace("Reaper tick removed {} expired entries", removed);
        } catch (Exception e) {
            // a failing tick must not cancel the schedule
            log.error("Expiry sweep failed: {}", e.getMessage(), e);
        }
    }

    public synchronized void stop() {
        if (!running) return;

        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) scheduler.shutdownNow();
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("ExpiryReaper stopped");
    }

    public boolean isRunning() {
        return running;
    }
}
