package com.iksanov.respcache.server.net;

import com.iksanov.respcache.server.metrics.NetMetrics;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.ChannelGroupFuture;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First handler of every client pipeline. Keeps the group of open client channels
 * so the listener can close them all on stop, and feeds the connection meters.
 * <p>
 * Exceptions are not handled here; they travel on to {@link RespConnectionHandler}.
 */
@ChannelHandler.Sharable
public class ClientConnectionTracker extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(ClientConnectionTracker.class);
    private final ChannelGroup clients = new DefaultChannelGroup("resp-clients", GlobalEventExecutor.INSTANCE);
    private final NetMetrics metrics;

    public ClientConnectionTracker(NetMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        Channel channel = ctx.channel();
        clients.add(channel);
        metrics.connectionOpened();
        log.debug("Client {} connected [{}], {} open", channel.remoteAddress(), channel.id().asShortText(), clients.size());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        metrics.connectionClosed();
        log.debug("Client {} disconnected [{}]", ctx.channel().remoteAddress(), ctx.channel().id().asShortText());
        super.channelInactive(ctx);
    }

    /**
     * @return number of client channels still open
     */
    public int openClients() {
        return clients.size();
    }

    /**
     * Closes every tracked client channel.
     */
    public ChannelGroupFuture closeAll() {
        log.info("Closing {} client connection(s)", clients.size());
        return clients.close();
    }
}
