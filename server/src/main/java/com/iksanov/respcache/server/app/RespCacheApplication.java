package com.iksanov.respcache.server.app;

import com.iksanov.respcache.common.exception.ConfigurationException;
import com.iksanov.respcache.server.command.CommandProcessor;
import com.iksanov.respcache.server.config.ApplicationConfig;
import com.iksanov.respcache.server.core.ExpiryReaper;
import com.iksanov.respcache.server.core.InMemoryCacheStore;
import com.iksanov.respcache.server.metrics.CacheMetrics;
import com.iksanov.respcache.server.metrics.MetricsServer;
import com.iksanov.respcache.server.metrics.NetMetrics;
import com.iksanov.respcache.server.net.NetServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main application class: wires the store, the expiry reaper, the RESP listener and
 * the optional metrics endpoint, and tears them down in reverse order on shutdown.
 */
public class RespCacheApplication {

    private static final Logger log = LoggerFactory.getLogger(RespCacheApplication.class);
    private final ApplicationConfig config;
    private InMemoryCacheStore cache;
    private ExpiryReaper reaper;
    private NetServer netServer;
    private MetricsServer metricsServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public RespCacheApplication(ApplicationConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        ApplicationConfig config;
        try {
            config = ApplicationConfig.fromEnv().withArgs(args);
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        log.info("========================================");
        log.info("Starting resp-cache on port {}", config.port());
        log.info("dir={}, dbfilename={}, role={}", config.dir(), config.dbFilename(), config.replication().role().wireName());
        log.info("========================================");

        RespCacheApplication app = new RespCacheApplication(config);
        try {
            app.start();
        } catch (Exception e) {
            log.error("Startup failed", e);
            app.shutdown();
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "shutdown-hook"));
        app.awaitShutdown();
    }

    public void start() {
        CacheMetrics cacheMetrics = new CacheMetrics();
        NetMetrics netMetrics = new NetMetrics();
        log.info("[OK] Metrics initialized");

        cache = new InMemoryCacheStore(cacheMetrics);
        reaper = new ExpiryReaper(cache, config.reaperIntervalMillis());
        reaper.start();
        log.info("[OK] Cache initialized (reaper interval={}ms)", config.reaperIntervalMillis());

        if (config.metricsPort() > 0) {
            metricsServer = new MetricsServer(config.metricsPort(), cacheMetrics, netMetrics);
            metricsServer.start();
            if (metricsServer.boundPort() > 0) {
                log.info("[OK] Metrics server started on port {}", metricsServer.boundPort());
            } else {
                log.warn("[FAILED] Metrics server did not start on port {}, continuing without it", config.metricsPort());
            }
        }

        CommandProcessor processor = new CommandProcessor(cache, config.toServerParameters(), config.replication());
        netServer = new NetServer(config.toNetServerConfig(), processor, netMetrics);
        netServer.start();
        log.info("[OK] Server listening on {}:{}", config.host(), netServer.boundPort());
    }

    public int port() {
        return netServer == null ? -1 : netServer.boundPort();
    }

    public synchronized void shutdown() {
        if (shutdownLatch.getCount() == 0) return;
        log.info("Shutting down resp-cache...");
        try {
            if (netServer != null && netServer.isRunning()) {
                netServer.stop();
                log.info("[OK] NetServer stopped");
            }
            if (reaper != null) {
                reaper.stop();
                log.info("[OK] ExpiryReaper stopped");
            }
            if (metricsServer != null) {
                metricsServer.shutdown();
            }
            if (cache != null) {
                cache.clear();
            }
            log.info("[SUCCESS] Shutdown complete");
        } catch (Exception e) {
            log.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    private void awaitShutdown() {
        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
