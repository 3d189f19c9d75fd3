package com.shlokmestry.trafficcontrol.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.shlokmestry.trafficcontrol.MutableClock;

class RequestHistoryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final RequestHistory history = new RequestHistory(RateLimitProperties.defaults(), clock);
    private final ClientKey key = new ClientKey("10.0.0.1", "/api/analyze");

    @Test
    void countsOnlyEarlierRequestsInsideTheLastSecond() {
        assertThat(history.recordAndCountRecent(key, T0)).isZero();
        assertThat(history.recordAndCountRecent(key, T0.plusMillis(200))).isEqualTo(1);
        assertThat(history.recordAndCountRecent(key, T0.plusMillis(900))).isEqualTo(2);

        // T0 has dropped out, the 200ms and 900ms requests remain
        assertThat(history.recordAndCountRecent(key, T0.plusMillis(1100))).isEqualTo(2);
    }

    @Test
    void idleKeysAreSweptAfterAWindow() {
        history.recordAndCountRecent(key, T0);
        history.recordAndCountRecent(new ClientKey("10.0.0.2", "/api/health"), T0);

        clock.advance(Duration.ofSeconds(61));
        history.recordAndCountRecent(key, clock.instant());

        assertThat(history.trackedKeys()).isEqualTo(1);
    }

    @Test
    void concurrentRecording_keepsEveryTimestamp() throws Exception {
        int threads = 8;
        int perThread = 250;
        List<Integer> seen = new CopyOnWriteArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        seen.add(history.recordAndCountRecent(key, T0));
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(seen).hasSize(threads * perThread).doesNotHaveDuplicates();
        assertThat(history.recordAndCountRecent(key, T0)).isEqualTo(threads * perThread);
    }
}
