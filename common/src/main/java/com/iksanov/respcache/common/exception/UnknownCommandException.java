package com.iksanov.respcache.common.exception;

public class UnknownCommandException extends CacheException {
    public static final String MESSAGE = "ERR unknown command";

    public UnknownCommandException() {
        super(MESSAGE);
    }
}
