package com.iksanov.respcache.common.codec;

import com.iksanov.respcache.common.resp.Reply;
import com.iksanov.respcache.common.resp.RespCommand;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;

/**
 * Writes RESP wire bytes. No escaping is done: simple strings and error messages
 * must not contain CR or LF.
 */
public final class RespWriter {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = {'$', '-', '1', '\r', '\n'};

    private RespWriter() {
    }

    public static void write(Reply reply, ByteBuf out) {
        if (reply instanceof Reply.Simple simple) {
            writeLine(out, '+', simple.text());
        } else if (reply instanceof Reply.Bulk bulk) {
            writeBulk(out, bulk.bytes());
        } else if (reply instanceof Reply.Null) {
            out.writeBytes(NULL_BULK);
        } else if (reply instanceof Reply.Array array) {
            writeLine(out, '*', Integer.toString(array.items().size()));
            for (Reply item : array.items()) {
                write(item, out);
            }
        } else if (reply instanceof Reply.Error error) {
            writeLine(out, '-', error.message());
        } else {
            throw new IllegalArgumentException("Unsupported reply type: " + reply.getClass());
        }
    }

    /**
     * Writes a command in request form: an array of bulk strings.
     */
    public static void writeCommand(RespCommand command, ByteBuf out) {
        writeLine(out, '*', Integer.toString(command.arity()));
        for (byte[] argument : command.arguments()) {
            writeBulk(out, argument);
        }
    }

    public static byte[] encode(Reply reply) {
        ByteBuf buffer = Unpooled.buffer();
        try {
            write(reply, buffer);
            return ByteBufUtil.getBytes(buffer);
        } finally {
            buffer.release();
        }
    }

    public static byte[] encode(RespCommand command) {
        ByteBuf buffer = Unpooled.buffer();
        try {
            writeCommand(command, buffer);
            return ByteBufUtil.getBytes(buffer);
        } finally {
            buffer.release();
        }
    }

    private static void writeBulk(ByteBuf out, byte[] bytes) {
        writeLine(out, '$', Integer.toString(bytes.length));
        out.writeBytes(bytes);
        out.writeBytes(CRLF);
    }

    private static void writeLine(ByteBuf out, char prefix, String text) {
        out.writeByte(prefix);
        out.writeCharSequence(text, StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }
}
