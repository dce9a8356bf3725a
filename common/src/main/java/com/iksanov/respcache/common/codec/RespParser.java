package com.iksanov.respcache.common.codec;

import com.iksanov.respcache.common.resp.RespCommand;
import io.netty.buffer.ByteBuf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses one RESP request (an array of bulk strings) from the readable bytes of a buffer.
 * <p>
 * The parser never moves the reader index and copies argument bytes only once the whole
 * frame is buffered. The caller decides what to do with the result:
 *  - {@link Complete}: a full frame is present; skip {@code consumedBytes}
 *  - {@link Incomplete}: keep the bytes and wait for more
 *  - {@link Malformed}: the bytes can never form a valid request
 * <p>
 * Thread-safe: the parser holds only immutable limits.
 */
public final class RespParser {

    public static final int DEFAULT_MAX_ARGUMENTS = 1024;
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int MAX_HEADER_LINE_LENGTH = 64 * 1024;

    private static final int MAX_INTEGER_DIGITS = 10;

    private final int maxArguments;
    private final int maxBulkLength;

    public RespParser() {
        this(DEFAULT_MAX_ARGUMENTS, DEFAULT_MAX_BULK_LENGTH);
    }

    public RespParser(int maxArguments, int maxBulkLength) {
        if (maxArguments <= 0) throw new IllegalArgumentException("maxArguments must be > 0");
        if (maxBulkLength < 0) throw new IllegalArgumentException("maxBulkLength must be >= 0");
        this.maxArguments = maxArguments;
        this.maxBulkLength = maxBulkLength;
    }

    public sealed interface Result permits Complete, Incomplete, Malformed {
    }

    /**
     * A complete frame. {@code command} is {@code null} for an empty array ({@code *0\r\n}),
     * which carries no command but still consumes its bytes.
     */
    public record Complete(RespCommand command, int consumedBytes) implements Result {
    }

    public record Incomplete() implements Result {
    }

    public record Malformed(String detail) implements Result {
    }

    private static final Incomplete INCOMPLETE = new Incomplete();

    public Result parse(ByteBuf in) {
        final int start = in.readerIndex();
        final int end = in.writerIndex();
        if (start >= end) return INCOMPLETE;

        byte marker = in.getByte(start);
        if (marker != '*') return new Malformed("expected '*', got '" + printable(marker) + "'");

        int lineEnd = findLineEnd(in, start + 1, end);
        if (lineEnd == NEED_MORE) return lineTooLong(start, end) ? new Malformed("too big multibulk header") : INCOMPLETE;
        if (lineEnd == BAD_TERMINATOR) return new Malformed("expected CRLF after multibulk length");

        long argc = parseNonNegative(in, start + 1, lineEnd);
        if (argc < 0 || argc > maxArguments) return new Malformed("invalid multibulk length");

        int pos = lineEnd + 2;
        // start offset and length of each argument, copied out once the frame is complete
        int[] slices = new int[2 * (int) Math.min(argc, 16)];
        for (long i = 0; i < argc; i++) {
            if (pos >= end) return INCOMPLETE;

            marker = in.getByte(pos);
            if (marker != '$') return new Malformed("expected '$', got '" + printable(marker) + "'");

            lineEnd = findLineEnd(in, pos + 1, end);
            if (lineEnd == NEED_MORE) return lineTooLong(pos, end) ? new Malformed("too big bulk header") : INCOMPLETE;
            if (lineEnd == BAD_TERMINATOR) return new Malformed("expected CRLF after bulk length");

            long length = parseNonNegative(in, pos + 1, lineEnd);
            if (length < 0 || length > maxBulkLength) return new Malformed("invalid bulk length");

            int dataStart = lineEnd + 2;
            long dataEnd = dataStart + length;
            if (dataEnd + 2 > end) return INCOMPLETE;
            if (in.getByte((int) dataEnd) != '\r' || in.getByte((int) dataEnd + 1) != '\n') {
                return new Malformed("bulk length does not match payload");
            }

            int slot = 2 * (int) i;
            if (slot == slices.length) slices = Arrays.copyOf(slices, slices.length * 2);
            slices[slot] = dataStart;
            slices[slot + 1] = (int) length;
            pos = (int) dataEnd + 2;
        }

        if (argc == 0) return new Complete(null, pos - start);
        List<byte[]> arguments = new ArrayList<>((int) argc);
        for (int i = 0; i < argc; i++) {
            byte[] bytes = new byte[slices[2 * i + 1]];
            in.getBytes(slices[2 * i], bytes);
            arguments.add(bytes);
        }
        return new Complete(new RespCommand(arguments), pos - start);
    }

    private static final int NEED_MORE = -1;
    private static final int BAD_TERMINATOR = -2;

    /**
     * @return index of the '\r' ending the line that starts at {@code from},
     *         {@link #NEED_MORE} if no terminator is buffered yet,
     *         or {@link #BAD_TERMINATOR} if '\r' is followed by anything but '\n'
     */
    private static int findLineEnd(ByteBuf in, int from, int end) {
        int cr = in.indexOf(from, end, (byte) '\r');
        if (cr < 0 || cr + 1 >= end) return NEED_MORE;
        return in.getByte(cr + 1) == '\n' ? cr : BAD_TERMINATOR;
    }

    private static boolean lineTooLong(int lineStart, int end) {
        return end - lineStart > MAX_HEADER_LINE_LENGTH;
    }

    /**
     * Parses a base-10 integer made only of digits. Returns -1 when the text is empty,
     * contains anything but digits, or is too large to be a length.
     */
    private static long parseNonNegative(ByteBuf in, int from, int to) {
        int digits = to - from;
        if (digits == 0 || digits > MAX_INTEGER_DIGITS) return -1;
        long value = 0;
        for (int i = from; i < to; i++) {
            byte b = in.getByte(i);
            if (b < '0' || b > '9') return -1;
            value = value * 10 + (b - '0');
        }
        return value > Integer.MAX_VALUE ? -1 : value;
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("\\x%02x", b & 0xff);
    }
}
