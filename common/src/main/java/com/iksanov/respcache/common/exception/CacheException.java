package com.iksanov.respcache.common.exception;

/**
 * Base class for every failure raised by the RESP cache.
 * The message is what the client sees after the leading '-' of an error reply.
 */
public class CacheException extends RuntimeException {
    public CacheException(String message) {
        super(message);
    }
    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
