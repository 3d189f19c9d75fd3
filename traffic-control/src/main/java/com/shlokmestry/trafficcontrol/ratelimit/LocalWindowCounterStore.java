package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local counters used while the shared store is unavailable.
 *
 * <p>Each key keeps the timestamps of its requests; the count is the number of timestamps in the
 * current window. Stale timestamps are pruned lazily, at most once per window.
 */
public class LocalWindowCounterStore implements WindowCounterStore {

    private final ConcurrentMap<ClientKey, Deque<Instant>> requests = new ConcurrentHashMap<>();
    private final Duration window;
    private volatile Instant lastCleanup;

    public LocalWindowCounterStore(Duration window, Clock clock) {
        this.window = window;
        this.lastCleanup = clock.instant();
    }

    @Override
    public long increment(ClientKey key, Instant now) {
        if (Duration.between(lastCleanup, now).compareTo(window) > 0) {
            cleanup(now);
        }

        long currentWindow = WindowCounterStore.windowIndex(now, window);
        long[] count = new long[1];
        requests.compute(key, (k, timestamps) -> {
            Deque<Instant> q = timestamps == null ? new ArrayDeque<>() : timestamps;
            q.addLast(now);
            count[0] = q.stream()
                    .filter(t -> WindowCounterStore.windowIndex(t, window) == currentWindow)
                    .count();
            return q;
        });
        return count[0];
    }

    void cleanup(Instant now) {
        lastCleanup = now;
        long currentWindow = WindowCounterStore.windowIndex(now, window);
        for (ClientKey key : requests.keySet()) {
            requests.computeIfPresent(key, (k, q) -> {
                q.removeIf(t -> WindowCounterStore.windowIndex(t, window) < currentWindow);
                return q.isEmpty() ? null : q;
            });
        }
    }

    int trackedKeys() {
        return requests.size();
    }
}
