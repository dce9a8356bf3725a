package com.iksanov.respcache.server.core;

import com.iksanov.respcache.server.metrics.CacheMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link InMemoryCacheStore}: overwrite semantics, lazy expiry and sweeps,
 * driven by a {@link MutableClock} so expiry is deterministic.
 */
@DisplayName("InMemoryCacheStore - expiry-aware key-value store")
class InMemoryCacheStoreTest {

    private MutableClock clock;
    private CacheMetrics metrics;
    private InMemoryCacheStore cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        metrics = new CacheMetrics();
        cache = new InMemoryCacheStore(clock, metrics);
    }

    @Test
    @DisplayName("set() and get() should store and retrieve values")
    void shouldStoreAndRetrieveValues() {
        cache.set(b("user:1"), b("John"));
        cache.set(b("user:2"), b("Jane"));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(s(cache.get(b("user:1")))).isEqualTo("John");
        assertThat(s(cache.get(b("user:2")))).isEqualTo("Jane");
        assertThat(metrics.hits()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("get() should return null for a key never set")
    void shouldReturnNullForMissingKey() {
        assertThat(cache.get(b("missing"))).isNull();
        assertThat(metrics.misses()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Keys are compared by content, not by array identity")
    void shouldMatchKeysByContent() {
        cache.set(new byte[]{1, 2, 3}, b("v"));
        assertThat(cache.get(new byte[]{1, 2, 3})).isNotNull();
    }

    @Test
    @DisplayName("Stored values are isolated from later mutation of the caller's arrays")
    void shouldCopyValues() {
        byte[] value = b("abc");
        cache.set(b("k"), value);
        value[0] = 'X';

        byte[] read = cache.get(b("k"));
        assertThat(s(read)).isEqualTo("abc");
        read[1] = 'Y';
        assertThat(s(cache.get(b("k")))).isEqualTo("abc");
    }

    @Test
    @DisplayName("Entry should be visible before its TTL and absent once the TTL has passed")
    void shouldExpireAfterTtl() {
        cache.set(b("temp"), b("data"), 50);

        clock.advance(Duration.ofMillis(49));
        assertThat(s(cache.get(b("temp")))).isEqualTo("data");

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.get(b("temp"))).isNull();
        assertThat(cache.size()).as("expired entry is evicted on read").isZero();
        assertThat(metrics.expirations()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A TTL of 0 produces an entry that is already expired")
    void shouldTreatZeroTtlAsExpired() {
        cache.set(b("k"), b("v"), 0);
        assertThat(cache.get(b("k"))).isNull();
    }

    @Test
    @DisplayName("set() without TTL should clear a previous expiry")
    void shouldClearExpiryOnPlainSet() {
        cache.set(b("k"), b("v1"), 10);
        cache.set(b("k"), b("v2"));

        clock.advance(Duration.ofHours(1));
        assertThat(s(cache.get(b("k")))).isEqualTo("v2");
    }

    @Test
    @DisplayName("set() with TTL should replace, not extend, a previous expiry")
    void shouldReplaceExpiryOnSetWithTtl() {
        cache.set(b("k"), b("v1"), 1000);
        cache.set(b("k"), b("v2"), 10);

        clock.advance(Duration.ofMillis(10));
        assertThat(cache.get(b("k"))).isNull();
    }

    @Test
    @DisplayName("Repeating the same set() leaves the same observable state")
    void shouldBeIdempotentForRepeatedSet() {
        for (int i = 0; i < 5; i++) {
            cache.set(b("k"), b("v"));
        }
        assertThat(cache.size()).isEqualTo(1);
        assertThat(s(cache.get(b("k")))).isEqualTo("v");
    }

    @Test
    @DisplayName("removeExpired() should drop only expired entries")
    void shouldRemoveOnlyExpiredEntries() {
        cache.set(b("short"), b("1"), 10);
        cache.set(b("long"), b("2"), 10_000);
        cache.set(b("forever"), b("3"));

        clock.advance(Duration.ofMillis(100));

        assertThat(cache.removeExpired()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(b("long"))).isNotNull();
        assertThat(cache.get(b("forever"))).isNotNull();
    }

    @Test
    @DisplayName("Huge TTLs should not overflow into the past")
    void shouldSaturateHugeTtl() {
        cache.set(b("k"), b("v"), Long.MAX_VALUE);
        assertThat(cache.get(b("k"))).isNotNull();
    }

    @Test
    @DisplayName("Negative TTLs are rejected")
    void shouldRejectNegativeTtl() {
        assertThatThrownBy(() -> cache.set(b("k"), b("v"), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("clear() should remove all entries")
    void shouldClearAllEntries() {
        cache.set(b("a"), b("1"));
        cache.set(b("b"), b("2"));

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.get(b("a"))).isNull();
    }

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String s(byte[] bytes) {
        return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
    }
}
