package com.iksanov.respcache.server.net;

import com.iksanov.respcache.server.command.CommandProcessor;
import com.iksanov.respcache.server.config.NetServerConfig;
import com.iksanov.respcache.server.metrics.NetMetrics;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NetServer - Netty TCP listener speaking RESP.
 * <p>
 * Responsibilities:
 *  - Initializes and manages Netty event loops (boss accepts, workers serve connections)
 *  - Builds the pipeline: framing -> codec -> command dispatch
 *  - Handles lifecycle: start(), stop(), graceful shutdown
 * <p>
 * Every connection shares the single {@link CommandProcessor} and therefore the single store.
 */
public final class NetServer {

    private static final Logger log = LoggerFactory.getLogger(NetServer.class);
    private final NetServerConfig config;
    private final CommandProcessor processor;
    private final NetMetrics metrics;
    private final ClientConnectionTracker connectionTracker;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile boolean running = false;

    public NetServer(NetServerConfig config, CommandProcessor processor, NetMetrics netMetrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.metrics = Objects.requireNonNull(netMetrics, "netMetrics");
        this.connectionTracker = new ClientConnectionTracker(netMetrics);
    }

    /**
     * Binds the listening socket and returns once the server accepts connections.
     *
     * @throws IllegalStateException if the port cannot be bound
     */
    public synchronized void start() {
        if (running) {
            log.warn("NetServer is already running on {}:{}", config.host(), boundPort());
            return;
        }

        bossGroup = new NioEventLoopGroup(Math.max(1, config.bossThreads()));
        workerGroup = config.workerThreads() > 0 ? new NioEventLoopGroup(config.workerThreads()) : new NioEventLoopGroup();

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_BACKLOG, config.backlog())
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                    .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .handler(new LoggingHandler(LogLevel.INFO))
                    .childHandler(new NetServerInitializer(processor, config.maxFrameLength(), config.partialFrameTimeoutMillis(),
                            connectionTracker, metrics));

            InetSocketAddress address = new InetSocketAddress(config.host(), config.port());
            log.info("Starting NetServer on {}:{} with config: {}", config.host(), config.port(), config);
            ChannelFuture future = bootstrap.bind(address).awaitUninterruptibly();
            if (!future.isSuccess()) {
                log.error("Failed to bind NetServer on {}:{}", config.host(), config.port(), future.cause());
                shutdownEventLoopGroupsQuietly();
                throw new IllegalStateException("Failed to bind " + config.host() + ":" + config.port(), future.cause());
            }
            serverChannel = future.channel();
            running = true;
            metrics.listenerStarted();
            log.info("NetServer started successfully on {}:{}", config.host(), boundPort());
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            log.error("Unexpected error while starting NetServer", e);
            shutdownEventLoopGroupsQuietly();
            throw new IllegalStateException("NetServer startup failed", e);
        }
    }

    /**
     * Stops accepting connections, closes the open client connections, then lets the event loops drain.
     */
    public synchronized void stop() {
        if (!running) {
            log.warn("NetServer is not running");
            return;
        }

        log.info("Stopping NetServer on {}:{}", config.host(), boundPort());
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
            }
            connectionTracker.closeAll().awaitUninterruptibly(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (Exception e) {
            log.error("Error closing NetServer channel: {}", e.getMessage(), e);
        } finally {
            shutdownEventLoopGroups();
            running = false;
            metrics.listenerStopped();
            log.info("NetServer stopped successfully");
        }
    }

    /**
     * @return the actual listening port (useful when configured with port 0), or -1 if not bound
     */
    public int boundPort() {
        Channel channel = serverChannel;
        if (channel == null || !(channel.localAddress() instanceof InetSocketAddress address)) return -1;
        return address.getPort();
    }

    /**
     * @return number of client connections currently open
     */
    public int openConnections() {
        return connectionTracker.openClients();
    }

    public boolean isRunning() {
        return running;
    }

    private void shutdownEventLoopGroups() {
        try {
            log.debug("Shutting down Netty event loops (boss={}, worker={})...", bossGroup != null, workerGroup != null);
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(
                                config.shutdownQuietPeriodSeconds(),
                                config.shutdownTimeoutSeconds(),
                                TimeUnit.SECONDS
                        )
                        .await(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS);
            }

            if (workerGroup != null) {
                workerGroup.shutdownGracefully(
                                config.shutdownQuietPeriodSeconds(),
                                config.shutdownTimeoutSeconds(),
                                TimeUnit.SECONDS
                        )
                        .await(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during NetServer shutdown");
        }
    }

    private void shutdownEventLoopGroupsQuietly() {
        if (workerGroup != null) workerGroup.shutdownGracefully();
        if (bossGroup != null) bossGroup.shutdownGracefully();
    }
}
