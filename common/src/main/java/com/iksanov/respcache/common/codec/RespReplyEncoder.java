package com.iksanov.respcache.common.codec;

import com.iksanov.respcache.common.resp.Reply;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

@ChannelHandler.Sharable
public class RespReplyEncoder extends MessageToByteEncoder<Reply> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Reply reply, ByteBuf out) {
        RespWriter.write(reply, out);
    }
}
