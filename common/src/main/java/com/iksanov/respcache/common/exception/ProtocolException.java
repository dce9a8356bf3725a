package com.iksanov.respcache.common.exception;

import io.netty.handler.codec.CorruptedFrameException;

/**
 * Raised when inbound bytes do not form a valid RESP request.
 * <p>
 * Extends {@link CorruptedFrameException}, itself a {@code DecoderException}, so
 * {@code ByteToMessageDecoder} rethrows it as is and {@code exceptionCaught} sees this type.
 */
public class ProtocolException extends CorruptedFrameException {
    private static final String PREFIX = "Protocol error: ";

    public ProtocolException(String detail) {
        super(PREFIX + detail);
    }

    /**
     * @return the text of the error reply sent to the client
     */
    public String replyMessage() {
        return "ERR " + getMessage();
    }
}
