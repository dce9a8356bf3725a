package com.iksanov.respcache.server.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable binary key with content-based equality, usable as a hash map key.
 */
public final class CacheKey {

    private final byte[] bytes;
    private final int hash;

    private CacheKey(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    public static CacheKey of(byte[] bytes) {
        return new CacheKey(Objects.requireNonNull(bytes, "key").clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof CacheKey other && hash == other.hash && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
