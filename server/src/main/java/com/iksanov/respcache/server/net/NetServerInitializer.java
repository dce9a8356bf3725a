package com.iksanov.respcache.server.net;

import com.iksanov.respcache.common.codec.RespCommandDecoder;
import com.iksanov.respcache.common.codec.RespParser;
import com.iksanov.respcache.common.codec.RespReplyEncoder;
import com.iksanov.respcache.server.command.CommandProcessor;
import com.iksanov.respcache.server.metrics.NetMetrics;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.timeout.IdleStateHandler;

import java.util.concurrent.TimeUnit;

/**
 * NetServerInitializer configures the Netty pipeline for each accepted client connection.
 * <p>
 * The pipeline is:
 *  - open-connection tracking (ClientConnectionTracker)
 *  - reader-idle detection for stalled partial frames (IdleStateHandler, optional)
 *  - RESP framing (RespCommandDecoder / RespReplyEncoder)
 *  - command dispatch (RespConnectionHandler)
 */
public class NetServerInitializer extends ChannelInitializer<SocketChannel> {
    private final RespParser parser;
    private final long partialFrameTimeoutMillis;
    private final ClientConnectionTracker connectionTracker;
    private final RespReplyEncoder encoder = new RespReplyEncoder();
    private final RespConnectionHandler connectionHandler;

    public NetServerInitializer(CommandProcessor processor, int maxFrameLength, long partialFrameTimeoutMillis,
                                ClientConnectionTracker connectionTracker, NetMetrics metrics) {
        this.parser = new RespParser(RespParser.DEFAULT_MAX_ARGUMENTS, maxFrameLength);
        this.partialFrameTimeoutMillis = partialFrameTimeoutMillis;
        this.connectionTracker = connectionTracker;
        this.connectionHandler = new RespConnectionHandler(processor, metrics);
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        configure(ch.pipeline());
    }

    void configure(ChannelPipeline p) {
        p.addLast(connectionTracker);
        p.addLast(new LoggingHandler(LogLevel.DEBUG));
        if (partialFrameTimeoutMillis > 0) {
            p.addLast(new IdleStateHandler(partialFrameTimeoutMillis, 0, 0, TimeUnit.MILLISECONDS));
        }
        p.addLast(new RespCommandDecoder(parser));
        p.addLast(encoder);
        p.addLast(connectionHandler);
    }
}
