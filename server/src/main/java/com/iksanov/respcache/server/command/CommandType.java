package com.iksanov.respcache.server.command;

import com.iksanov.respcache.common.exception.CommandException;
import com.iksanov.respcache.common.exception.UnknownCommandException;

import java.util.Locale;

/**
 * Supported commands with their accepted arities (including the command name).
 */
public enum CommandType {
    PING(1, 1),
    ECHO(2, 2),
    SET(3, 5),
    GET(2, 2),
    CONFIG(3, 3),
    INFO(1, 2);

    private final int minArity;
    private final int maxArity;

    CommandType(int minArity, int maxArity) {
        this.minArity = minArity;
        this.maxArity = maxArity;
    }

    /**
     * @throws UnknownCommandException if no command has this name
     */
    public static CommandType fromName(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownCommandException();
        }
    }

    /**
     * @throws CommandException if {@code arity} is outside this command's accepted range
     */
    public void checkArity(int arity) {
        if (arity < minArity || arity > maxArity) throw CommandException.wrongArity(name().toLowerCase(Locale.ROOT));
    }
}
