package com.iksanov.respcache.common.codec;

import com.iksanov.respcache.common.exception.ProtocolException;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * Turns the inbound byte stream of one connection into {@link com.iksanov.respcache.common.resp.RespCommand}s.
 * <p>
 * Netty's cumulation buffer holds bytes across reads, so a frame split over several
 * TCP segments is emitted once it completes, and several frames arriving in one read
 * are emitted in order. A malformed frame drops everything buffered and raises
 * {@link ProtocolException}.
 * <p>
 * Not sharable: each channel needs its own instance.
 */
public class RespCommandDecoder extends ByteToMessageDecoder {

    private final RespParser parser;

    public RespCommandDecoder() {
        this(new RespParser());
    }

    public RespCommandDecoder(RespParser parser) {
        this.parser = parser;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        RespParser.Result result = parser.parse(in);
        if (result instanceof RespParser.Complete complete) {
            in.skipBytes(complete.consumedBytes());
            if (complete.command() != null) out.add(complete.command());
        } else if (result instanceof RespParser.Malformed malformed) {
            in.skipBytes(in.readableBytes());
            throw new ProtocolException(malformed.detail());
        }
    }

    /**
     * @return true if bytes of an unfinished frame are waiting for the rest of the frame
     */
    public boolean hasPartialFrame() {
        return actualReadableBytes() > 0;
    }
}
