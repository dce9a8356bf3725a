package com.iksanov.respcache.server.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only parameter table answered by {@code CONFIG GET}.
 * Built once at startup and shared by every connection without synchronization.
 */
public final class ServerParameters {

    public static final String DIR = "dir";
    public static final String DB_FILENAME = "dbfilename";
    public static final String PORT = "port";

    private final Map<String, String> values;

    private ServerParameters(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static ServerParameters of(String dir, String dbFilename, int port) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(DIR, Objects.requireNonNull(dir, "dir"));
        values.put(DB_FILENAME, Objects.requireNonNull(dbFilename, "dbFilename"));
        values.put(PORT, Integer.toString(port));
        return new ServerParameters(values);
    }

    /**
     * Looks a parameter up by name, ignoring case.
     */
    public Optional<String> get(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(values.get(name.toLowerCase(Locale.ROOT)));
    }

    @Override
    public String toString() {
        return "ServerParameters" + values;
    }
}
