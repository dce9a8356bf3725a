package com.iksanov.respcache.server.core;

/**
 * Shared key-value store with per-key expiry.
 * <p>
 * Every operation is atomic with respect to every other operation on the same key.
 * Expired entries are never returned, whether or not they were physically removed yet.
 */
public interface CacheStore {

    /**
     * Installs {@code value} under {@code key} with no expiry, replacing any previous entry and its expiry.
     */
    void set(byte[] key, byte[] value);

    /**
     * Installs {@code value} under {@code key}, expiring {@code ttlMillis} from now.
     * A TTL of 0 produces an entry that is already expired.
     */
    void set(byte[] key, byte[] value, long ttlMillis);

    /**
     * @return the live value, or {@code null} if the key is absent or expired; an expired entry is removed
     */
    byte[] get(byte[] key);

    /**
     * Removes every entry whose expiry has passed.
     *
     * @return number of entries removed
     */
    int removeExpired();

    int size();

    void clear();
}
