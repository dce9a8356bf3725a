package com.iksanov.respcache.server.metrics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.ServerSocket;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsServerTest {

    private CacheMetrics cacheMetrics;
    private NetMetrics netMetrics;
    private MetricsServer server;

    @BeforeEach
    void setUp() {
        cacheMetrics = new CacheMetrics();
        netMetrics = new NetMetrics();
        server = new MetricsServer(0, cacheMetrics, netMetrics);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.shutdown();
    }

    @Test
    void healthReportsUp() throws IOException {
        HttpURLConnection conn = open("/health");
        assertThat(conn.getResponseCode()).isEqualTo(200);
        assertThat(body(conn.getInputStream())).isEqualTo("{\"status\":\"UP\"}");
    }

    @Test
    void metricsExposeCacheAndNetworkMeters() throws IOException {
        cacheMetrics.recordHit();
        cacheMetrics.recordMiss();
        netMetrics.commandReceived();

        HttpURLConnection conn = open("/metrics");
        assertThat(conn.getResponseCode()).isEqualTo(200);
        String body = body(conn.getInputStream());
        assertThat(body).contains("cache_hits_total").contains("cache_misses_total").contains("resp_commands_received_total");
    }

    @Test
    void unknownPathIsNotFound() throws IOException {
        assertThat(open("/nope").getResponseCode()).isEqualTo(404);
    }

    @Test
    void portInUseLeavesServerUnbound() throws IOException {
        try (ServerSocket occupied = new ServerSocket(0)) {
            MetricsServer clash = new MetricsServer(occupied.getLocalPort(), cacheMetrics, netMetrics);
            clash.start();
            assertThat(clash.boundPort()).isEqualTo(-1);
            clash.shutdown();
        }
    }

    private HttpURLConnection open(String path) throws IOException {
        HttpURLConnection conn = (HttpURLConnection) new URL("http://127.0.0.1:" + server.boundPort() + path).openConnection();
        conn.setConnectTimeout(5_000);
        conn.setReadTimeout(5_000);
        return conn;
    }

    private static String body(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
