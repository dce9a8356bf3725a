package com.iksanov.respcache.server.core;

import com.iksanov.respcache.server.metrics.CacheMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExpiryReaperTest {

    @Mock
    private CacheStore mockStore;
    private ExpiryReaper reaper;

    @AfterEach
    void tearDown() {
        if (reaper != null) reaper.stop();
    }

    @Test
    @DisplayName("Reaper should remove expired keys that are never read")
    void shouldRemoveUnreadExpiredKeys() throws InterruptedException {
        InMemoryCacheStore store = new InMemoryCacheStore(new CacheMetrics());
        for (int i = 0; i < 100; i++) {
            store.set(("k" + i).getBytes(StandardCharsets.UTF_8), "v".getBytes(StandardCharsets.UTF_8), 20);
        }
        store.set("keep".getBytes(StandardCharsets.UTF_8), "v".getBytes(StandardCharsets.UTF_8));

        reaper = new ExpiryReaper(store, 10);
        reaper.start();

        long deadline = System.currentTimeMillis() + 2000;
        while (store.size() > 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("A failing sweep should not stop later sweeps")
    void shouldKeepRunningAfterFailure() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch recovered = new CountDownLatch(1);
        when(mockStore.removeExpired()).thenAnswer(invocation -> {
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("boom");
            recovered.countDown();
            return 0;
        });

        reaper = new ExpiryReaper(mockStore, 5);
        reaper.start();

        assertThat(recovered.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("start() and stop() should be idempotent")
    void shouldStartAndStopIdempotently() {
        reaper = new ExpiryReaper(mockStore, 50);
        reaper.start();
        reaper.start();
        assertThat(reaper.isRunning()).isTrue();

        reaper.stop();
        reaper.stop();
        assertThat(reaper.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Non-positive intervals are rejected")
    void shouldRejectNonPositiveInterval() {
        assertThatThrownBy(() -> new ExpiryReaper(mockStore, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
