package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.springframework.stereotype.Component;

// Burst detection only, never quotas.
@Component
public class RequestHistory {

    private final ConcurrentMap<ClientKey, Deque<Instant>> requests = new ConcurrentHashMap<>();
    private final Duration horizon;
    private final Duration sweepInterval;
    private volatile Instant lastSweep;

    public RequestHistory(RateLimitProperties properties, Clock clock) {
        this.horizon = properties.burstWindow();
        this.sweepInterval = properties.window();
        this.lastSweep = clock.instant();
    }

    /**
     * Records a request at {@code now}.
     *
     * @return how many earlier requests for {@code key} fall within the burst window before {@code now}
     */
    public int recordAndCountRecent(ClientKey key, Instant now) {
        if (Duration.between(lastSweep, now).compareTo(sweepInterval) > 0) {
            sweep(now);
        }

        Instant cutoff = now.minus(horizon);
        int[] recent = new int[1];
        requests.compute(key, (k, timestamps) -> {
            Deque<Instant> q = timestamps == null ? new ArrayDeque<>() : timestamps;
            while (!q.isEmpty() && !q.peekFirst().isAfter(cutoff)) {
                q.pollFirst();
            }
            recent[0] = q.size();
            q.addLast(now);
            return q;
        });
        return recent[0];
    }

    private void sweep(Instant now) {
        lastSweep = now;
        Instant cutoff = now.minus(horizon);
        for (ClientKey key : requests.keySet()) {
            requests.computeIfPresent(key, (k, q) -> {
                q.removeIf(t -> !t.isAfter(cutoff));
                return q.isEmpty() ? null : q;
            });
        }
    }

    int trackedKeys() {
        return requests.size();
    }
}
