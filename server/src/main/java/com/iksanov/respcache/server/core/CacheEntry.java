package com.iksanov.respcache.server.core;

/**
 * One stored value and its absolute expiry instant.
 * Immutable: every SET installs a fresh entry, so a value and its expiry can never be observed half-written.
 */
final class CacheEntry {
    static final long NO_EXPIRY = -1;

    final byte[] value;
    final long expireAt;

    CacheEntry(byte[] value, long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    boolean isExpired(long nowMillis) {
        return expireAt != NO_EXPIRY && expireAt <= nowMillis;
    }
}
