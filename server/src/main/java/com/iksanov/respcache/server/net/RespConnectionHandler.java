package com.iksanov.respcache.server.net;

import com.iksanov.respcache.common.codec.RespCommandDecoder;
import com.iksanov.respcache.common.exception.ProtocolException;
import com.iksanov.respcache.common.resp.Reply;
import com.iksanov.respcache.common.resp.RespCommand;
import com.iksanov.respcache.server.command.CommandProcessor;
import com.iksanov.respcache.server.metrics.NetMetrics;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * RespConnectionHandler is the last inbound handler of every client pipeline:
 *  - hands each decoded {@link RespCommand} to {@link CommandProcessor},
 *  - writes the {@link Reply} back before the next command is read from the cumulation buffer,
 *  - answers malformed or stalled frames with a protocol error and closes the connection,
 *  - closes only its own channel on I/O failure.
 * <p>
 * Stateless and safe to share: per-connection state lives in the channel's own decoder.
 */
@ChannelHandler.Sharable
public class RespConnectionHandler extends SimpleChannelInboundHandler<RespCommand> {

    static final String INCOMPLETE_FRAME = "ERR Protocol error: incomplete frame";
    private static final long SLOW_REQUEST_THRESHOLD_NANOS = 100_000_000L;
    private static final Logger log = LoggerFactory.getLogger(RespConnectionHandler.class);
    private final CommandProcessor processor;
    private final NetMetrics metrics;

    public RespConnectionHandler(CommandProcessor processor, NetMetrics metrics) {
        this.processor = processor;
        this.metrics = metrics;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RespCommand command) {
        metrics.commandReceived();
        long start = System.nanoTime();
        Reply reply = processor.process(command);
        long duration = System.nanoTime() - start;
        metrics.recordCommandDuration(duration);
        metrics.replyWritten(reply instanceof Reply.Error);
        if (duration > SLOW_REQUEST_THRESHOLD_NANOS) {
            log.warn("Slow command {} took {} ms", command.name(), duration / 1_000_000);
        } else {
            log.debug("Command {} processed in {} us", command.name(), duration / 1_000);
        }
        ctx.writeAndFlush(reply);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) {
        if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.READER_IDLE) {
            RespCommandDecoder decoder = ctx.pipeline().get(RespCommandDecoder.class);
            if (decoder != null && decoder.hasPartialFrame()) {
                metrics.protocolError();
                log.warn("Closing {}: incomplete frame idle for too long", ctx.channel().remoteAddress());
                ctx.writeAndFlush(Reply.error(INCOMPLETE_FRAME)).addListener(ChannelFutureListener.CLOSE);
            }
            return;
        }
        ctx.fireUserEventTriggered(evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        ProtocolException protocolError = findProtocolError(cause);
        if (protocolError != null) {
            metrics.protocolError();
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), protocolError.getMessage());
            ctx.writeAndFlush(Reply.error(protocolError.replyMessage())).addListener(ChannelFutureListener.CLOSE);
            return;
        }

        metrics.channelFailed();
        if (cause instanceof IOException) {
            log.warn("I/O error on channel {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("Unhandled exception in channel {}: {}", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        }
        ctx.close();
    }

    private static ProtocolException findProtocolError(Throwable cause) {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof ProtocolException pe) return pe;
        }
        return null;
    }
}
