package com.iksanov.respcache.common.resp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A decoded request: a non-empty, ordered list of binary arguments.
 * The first argument is the command name.
 */
public final class RespCommand {

    private final List<byte[]> arguments;

    public RespCommand(List<byte[]> arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.isEmpty()) throw new IllegalArgumentException("command must have at least one argument");
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static RespCommand of(String... arguments) {
        List<byte[]> args = new ArrayList<>(arguments.length);
        for (String argument : arguments) {
            args.add(argument.getBytes(StandardCharsets.UTF_8));
        }
        return new RespCommand(args);
    }

    /**
     * @return the command name, upper-cased for case-insensitive matching
     */
    public String name() {
        return argumentAsString(0).toUpperCase(Locale.ROOT);
    }

    public int arity() {
        return arguments.size();
    }

    public byte[] argument(int index) {
        return arguments.get(index);
    }

    public String argumentAsString(int index) {
        return new String(arguments.get(index), StandardCharsets.UTF_8);
    }

    public List<byte[]> arguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespCommand other)) return false;
        if (arguments.size() != other.arguments.size()) return false;
        for (int i = 0; i < arguments.size(); i++) {
            if (!Arrays.equals(arguments.get(i), other.arguments.get(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (byte[] argument : arguments) {
            result = 31 * result + Arrays.hashCode(argument);
        }
        return result;
    }

    @Override
    public String toString() {
        List<String> printable = new ArrayList<>(arguments.size());
        for (int i = 0; i < arguments.size(); i++) {
            printable.add(argumentAsString(i));
        }
        return "RespCommand" + printable;
    }
}
