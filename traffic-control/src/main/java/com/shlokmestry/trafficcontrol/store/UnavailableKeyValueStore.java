package com.shlokmestry.trafficcontrol.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Stand-in used when no shared store is configured: every call reports the store as unavailable,
 * so the limiter runs purely on its local fallback.
 */
public class UnavailableKeyValueStore implements KeyValueStore {

    private static final String MESSAGE = "shared store is not configured";

    @Override
    public boolean exists(String key) {
        throw new StoreUnavailableException(MESSAGE);
    }

    @Override
    public Optional<String> get(String key) {
        throw new StoreUnavailableException(MESSAGE);
    }

    @Override
    public long incr(String key) {
        throw new StoreUnavailableException(MESSAGE);
    }

    @Override
    public void expire(String key, Duration ttl) {
        throw new StoreUnavailableException(MESSAGE);
    }

    @Override
    public void setex(String key, Duration ttl, String value) {
        throw new StoreUnavailableException(MESSAGE);
    }

    @Override
    public void delete(String key) {
        throw new StoreUnavailableException(MESSAGE);
    }
}
