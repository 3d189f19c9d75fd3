package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shlokmestry.trafficcontrol.store.KeyValueStore;
import com.shlokmestry.trafficcontrol.store.StoreUnavailableException;

public class SharedWindowCounterStore implements WindowCounterStore {

    private static final Logger log = LoggerFactory.getLogger(SharedWindowCounterStore.class);
    private static final String PREFIX = "ratelimit:";

    private final KeyValueStore store;
    private final Duration window;

    public SharedWindowCounterStore(KeyValueStore store, Duration window) {
        this.store = store;
        this.window = window;
    }

    static String key(ClientKey key, long windowIndex) {
        return PREFIX + key.clientIp() + ":" + key.endpoint() + ":" + windowIndex;
    }

    @Override
    public long increment(ClientKey key, Instant now) {
        String redisKey = key(key, WindowCounterStore.windowIndex(now, window));
        long count = store.incr(redisKey);
        if (count == 1) {
            // Twice the window so a counter read near the boundary is not already gone.
            try {
                store.expire(redisKey, window.multipliedBy(2));
            } catch (StoreUnavailableException e) {
                // The increment already landed, so the count stands.
                log.warn("Counter TTL not set key={} error={}", redisKey, e.getMessage());
            }
        }
        return count;
    }
}
