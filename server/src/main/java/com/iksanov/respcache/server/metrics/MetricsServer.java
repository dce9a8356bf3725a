package com.iksanov.respcache.server.metrics;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Small HTTP server exposing Prometheus metrics on {@code /metrics} and liveness on {@code /health}.
 * Runs on its own port, separate from the RESP port.
 */
public class MetricsServer {

    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);
    private final int port;
    private final CacheMetrics cacheMetrics;
    private final NetMetrics netMetrics;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public MetricsServer(int port, CacheMetrics cacheMetrics, NetMetrics netMetrics) {
        this.port = port;
        this.cacheMetrics = cacheMetrics;
        this.netMetrics = netMetrics;
    }

    public void start() {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(1);
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new HttpServerCodec())
                                    .addLast(new HttpObjectAggregator(64 * 1024))
                                    .addLast(new MetricsHandler(cacheMetrics, netMetrics));
                        }
                    })
                    .option(ChannelOption.SO_BACKLOG, 128);
            serverChannel = bootstrap.bind(port).sync().channel();
            log.info("Metrics server started on port {}", boundPort());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while starting metrics server");
            shutdown();
        } catch (Exception e) {
            log.error("Failed to start metrics server on port {}", port, e);
            shutdown();
        }
    }

    public int boundPort() {
        if (serverChannel == null) return -1;
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void shutdown() {
        log.info("Shutting down metrics server...");
        if (serverChannel != null) serverChannel.close();
        if (workerGroup != null) workerGroup.shutdownGracefully();
        if (bossGroup != null) bossGroup.shutdownGracefully();
        log.info("Metrics server shut down");
    }

    static class MetricsHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        private final CacheMetrics cacheMetrics;
        private final NetMetrics netMetrics;

        MetricsHandler(CacheMetrics cacheMetrics, NetMetrics netMetrics) {
            this.cacheMetrics = cacheMetrics;
            this.netMetrics = netMetrics;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            String uri = request.uri();
            if ("/metrics".equals(uri)) {
                send(ctx, HttpResponseStatus.OK, "text/plain; version=0.0.4; charset=utf-8",
                        cacheMetrics.scrape() + "\n" + netMetrics.scrape());
            } else if ("/health".equals(uri)) {
                send(ctx, HttpResponseStatus.OK, "application/json", "{\"status\":\"UP\"}");
            } else {
                send(ctx, HttpResponseStatus.NOT_FOUND, "text/plain", "Not Found");
            }
        }

        private void send(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
            FullHttpResponse response = new DefaultFullHttpResponse(
                    HttpVersion.HTTP_1_1,
                    status,
                    Unpooled.copiedBuffer(body, StandardCharsets.UTF_8)
            );
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
            response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("Error in metrics handler", cause);
            ctx.close();
        }
    }
}
