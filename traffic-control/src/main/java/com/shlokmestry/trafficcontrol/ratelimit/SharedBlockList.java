package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Duration;
import java.time.Instant;

import com.shlokmestry.trafficcontrol.store.KeyValueStore;

/**
 * Blocks kept in the shared store as {@code blocked:<ip>} = reason; expiry is left to the store TTL.
 */
public class SharedBlockList implements BlockList {

    private static final String PREFIX = "blocked:";

    private final KeyValueStore store;
    private final Duration blockDuration;

    public SharedBlockList(KeyValueStore store, Duration blockDuration) {
        this.store = store;
        this.blockDuration = blockDuration;
    }

    static String key(String ip) {
        return PREFIX + ip;
    }

    @Override
    public boolean isBlocked(String ip, Instant now) {
        return store.exists(key(ip));
    }

    @Override
    public void block(BlockEntry entry) {
        store.setex(key(entry.ip()), blockDuration, entry.reason());
    }

    @Override
    public void unblock(String ip) {
        store.delete(key(ip));
    }
}
