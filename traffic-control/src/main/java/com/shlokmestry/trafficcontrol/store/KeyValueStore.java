package com.shlokmestry.trafficcontrol.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Minimal view of the shared key-value store used for counters and blocks.
 *
 * <p>Implementations raise {@link StoreUnavailableException} for any failure; callers treat that
 * as "store unavailable" and never as a hard error.
 */
public interface KeyValueStore {

    boolean exists(String key);

    Optional<String> get(String key);

    long incr(String key);

    void expire(String key, Duration ttl);

    void setex(String key, Duration ttl, String value);

    void delete(String key);
}
