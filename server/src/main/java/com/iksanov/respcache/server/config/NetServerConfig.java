package com.iksanov.respcache.server.config;

/**
 * Configuration holder for NetServer.
 * Defines all tunable parameters for networking.
 * <p>
 * {@code port} 0 binds an ephemeral port; {@code partialFrameTimeoutMillis} 0 disables the
 * incomplete-frame timeout.
 */
public record NetServerConfig(String host, int port, int bossThreads, int workerThreads, int backlog,
                              int maxFrameLength, int shutdownQuietPeriodSeconds, int shutdownTimeoutSeconds,
                              long partialFrameTimeoutMillis) {

    public NetServerConfig {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (maxFrameLength < 0) throw new IllegalArgumentException("maxFrameLength must be >= 0");
        if (partialFrameTimeoutMillis < 0) throw new IllegalArgumentException("partialFrameTimeoutMillis must be >= 0");
    }

    public static NetServerConfig defaults() {
        return new NetServerConfig("0.0.0.0", 6379, 1, 0, 256, 512 * 1024 * 1024, 0, 5, 10_000L);
    }
}
