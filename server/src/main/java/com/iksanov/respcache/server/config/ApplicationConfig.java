package com.iksanov.respcache.server.config;

import com.iksanov.respcache.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Map;

/**
 * Application configuration record for the RESP cache server.
 * <p>
 * Values are layered: built-in defaults, then environment variables ({@link #fromEnv()}),
 * then command-line flags ({@link #withArgs(String...)}).
 */
public record ApplicationConfig(
        String host,
        int port,
        String dir,
        String dbFilename,
        ReplicationInfo replication,
        int metricsPort,
        long reaperIntervalMillis,
        long partialFrameTimeoutMillis
) {
    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);

    public static final int DEFAULT_PORT = 6379;
    public static final String DEFAULT_DB_FILENAME = "dump.rdb";
    public static final long DEFAULT_REAPER_INTERVAL_MILLIS = 100;
    public static final long DEFAULT_PARTIAL_FRAME_TIMEOUT_MILLIS = 10_000;

    public ApplicationConfig {
        if (port < 0 || port > 65535) throw new ConfigurationException("Port out of range: " + port);
        if (metricsPort < 0 || metricsPort > 65535) throw new ConfigurationException("Metrics port out of range: " + metricsPort);
        if (reaperIntervalMillis <= 0) throw new ConfigurationException("Reaper interval must be > 0");
        if (partialFrameTimeoutMillis < 0) throw new ConfigurationException("Partial frame timeout must be >= 0");
        if (dir == null || dir.isBlank()) throw new ConfigurationException("dir must not be blank");
        if (dbFilename == null || dbFilename.isBlank()) throw new ConfigurationException("dbfilename must not be blank");
        if (replication == null) throw new ConfigurationException("replication must not be null");
    }

    public static ApplicationConfig defaults() {
        return new ApplicationConfig(
                "0.0.0.0",
                DEFAULT_PORT,
                Paths.get("").toAbsolutePath().toString(),
                DEFAULT_DB_FILENAME,
                ReplicationInfo.master(),
                0,
                DEFAULT_REAPER_INTERVAL_MILLIS,
                DEFAULT_PARTIAL_FRAME_TIMEOUT_MILLIS
        );
    }

    public static ApplicationConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static ApplicationConfig fromEnv(Map<String, String> env) {
        ApplicationConfig d = defaults();
        String replicaOf = env.get("RESP_CACHE_REPLICAOF");
        return new ApplicationConfig(
                getEnv(env, "RESP_CACHE_HOST", d.host()),
                getEnvInt(env, "RESP_CACHE_PORT", d.port()),
                getEnv(env, "RESP_CACHE_DIR", d.dir()),
                getEnv(env, "RESP_CACHE_DBFILENAME", d.dbFilename()),
                replicaOf == null || replicaOf.isBlank() ? d.replication() : parseReplicaOf(replicaOf),
                getEnvInt(env, "METRICS_PORT", d.metricsPort()),
                getEnvLong(env, "RESP_CACHE_REAPER_INTERVAL_MILLIS", d.reaperIntervalMillis()),
                getEnvLong(env, "RESP_CACHE_PARTIAL_FRAME_TIMEOUT_MILLIS", d.partialFrameTimeoutMillis())
        );
    }

    /**
     * Applies command-line flags on top of this configuration.
     * Supported: {@code --port|-p <n>}, {@code --dir <path>}, {@code --dbfilename <name>},
     * {@code --replicaof "<host> <port>"} (also accepted as two separate arguments).
     *
     * @throws ConfigurationException on an unknown flag, a missing value or a malformed number
     */
    public ApplicationConfig withArgs(String... args) {
        int port = this.port;
        String dir = this.dir;
        String dbFilename = this.dbFilename;
        ReplicationInfo replication = this.replication;

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "--port", "-p" -> port = parsePort(requireValue(args, ++i, flag), flag);
                case "--dir" -> dir = requireValue(args, ++i, flag);
                case "--dbfilename" -> dbFilename = requireValue(args, ++i, flag);
                case "--replicaof" -> {
                    String value = requireValue(args, ++i, flag);
                    if (!value.contains(" ") && i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        value = value + " " + args[++i];
                    }
                    replication = parseReplicaOf(value);
                }
                default -> throw new ConfigurationException("Unknown option: " + flag);
            }
        }
        return new ApplicationConfig(host, port, dir, dbFilename, replication, metricsPort, reaperIntervalMillis, partialFrameTimeoutMillis);
    }

    public NetServerConfig toNetServerConfig() {
        NetServerConfig d = NetServerConfig.defaults();
        return new NetServerConfig(host, port, d.bossThreads(), d.workerThreads(), d.backlog(),
                d.maxFrameLength(), d.shutdownQuietPeriodSeconds(), d.shutdownTimeoutSeconds(), partialFrameTimeoutMillis);
    }

    public ServerParameters toServerParameters() {
        return ServerParameters.of(dir, dbFilename, port);
    }

    static ReplicationInfo parseReplicaOf(String value) {
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 2) throw new ConfigurationException("replicaof expects \"<host> <port>\", got: " + value);
        return ReplicationInfo.replicaOf(parts[0], parsePort(parts[1], "replicaof"));
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) throw new ConfigurationException("Missing value for " + flag);
        return args[index];
    }

    private static int parsePort(String value, String source) {
        try {
            int port = Integer.parseInt(value);
            if (port < 0 || port > 65535) throw new ConfigurationException("Port out of range for " + source + ": " + value);
            return port;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid port for " + source + ": " + value, e);
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null ? value : defaultValue;
    }

    private static int getEnvInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={}, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static long getEnvLong(Map<String, String> env, String key, long defaultValue) {
        String value = env.get(key);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={}, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }
}
