package com.iksanov.respcache.server.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Meters of the RESP listener: client connections, commands and their replies,
 * protocol violations and listener start/stop events.
 */
public class NetMetrics {

    private static final Logger log = LoggerFactory.getLogger(NetMetrics.class);
    private final PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    private final AtomicInteger openConnections = new AtomicInteger();

    private final Counter connectionsOpened = tagged("resp.connections", "state", "opened", "Client connections accepted or closed");
    private final Counter connectionsClosed = tagged("resp.connections", "state", "closed", "Client connections accepted or closed");
    private final Counter commandsReceived = counter("resp.commands.received", "Decoded commands handed to the processor");
    private final Counter okReplies = tagged("resp.replies", "outcome", "ok", "Replies written, by outcome");
    private final Counter errorReplies = tagged("resp.replies", "outcome", "error", "Replies written, by outcome");
    private final Counter protocolErrors = counter("resp.protocol.errors", "Connections closed for a malformed or stalled frame");
    private final Counter channelFailures = counter("resp.channel.failures", "Connections closed by an I/O or unexpected failure");
    private final Counter listenerStarts = tagged("resp.listener.events", "event", "start", "Listener lifecycle events");
    private final Counter listenerStops = tagged("resp.listener.events", "event", "stop", "Listener lifecycle events");
    private final Timer commandDuration;

    public NetMetrics() {
        commandDuration = Timer.builder("resp.command.duration")
                .description("Time spent executing one command")
                .publishPercentiles(0.5, 0.99)
                .register(registry);
        Gauge.builder("resp.connections.open", openConnections, AtomicInteger::get)
                .description("Client connections currently open")
                .register(registry);
        log.debug("Listener meters registered");
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    private Counter tagged(String name, String tag, String value, String description) {
        return Counter.builder(name).tag(tag, value).description(description).register(registry);
    }

    public void connectionOpened() {
        connectionsOpened.increment();
        openConnections.incrementAndGet();
    }

    public void connectionClosed() {
        connectionsClosed.increment();
        openConnections.decrementAndGet();
    }

    public void commandReceived() { commandsReceived.increment(); }

    public void replyWritten(boolean error) {
        (error ? errorReplies : okReplies).increment();
    }

    public void recordCommandDuration(long nanos) { commandDuration.record(nanos, TimeUnit.NANOSECONDS); }
    public void protocolError() { protocolErrors.increment(); }
    public void channelFailed() { channelFailures.increment(); }
    public void listenerStarted() { listenerStarts.increment(); }
    public void listenerStopped() { listenerStops.increment(); }

    public int openConnections() { return openConnections.get(); }
    public double protocolErrors() { return protocolErrors.count(); }
    public double errorReplies() { return errorReplies.count(); }
    public double channelFailures() { return channelFailures.count(); }
    public String scrape() { return registry.scrape(); }
    public PrometheusMeterRegistry getRegistry() { return registry; }
}
