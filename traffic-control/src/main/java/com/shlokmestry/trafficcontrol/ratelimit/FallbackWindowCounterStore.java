package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shlokmestry.trafficcontrol.observability.TrafficMetrics;
import com.shlokmestry.trafficcontrol.store.StoreUnavailableException;

/**
 * Counts in the primary store and, when it is unavailable, in the secondary one instead.
 *
 * <p>Counts from the two stores are never added together: during an outage every instance
 * counts only what it sees itself, so a client spread over several instances is under-counted.
 */
public class FallbackWindowCounterStore implements WindowCounterStore {

    private static final Logger log = LoggerFactory.getLogger(FallbackWindowCounterStore.class);

    private final WindowCounterStore primary;
    private final WindowCounterStore secondary;
    private final TrafficMetrics metrics;

    public FallbackWindowCounterStore(WindowCounterStore primary, WindowCounterStore secondary, TrafficMetrics metrics) {
        this.primary = primary;
        this.secondary = secondary;
        this.metrics = metrics;
    }

    @Override
    public long increment(ClientKey key, Instant now) {
        try {
            return primary.increment(key, now);
        } catch (StoreUnavailableException e) {
            metrics.storeFallback("increment");
            log.warn("ratelimit fallback=local reason=store_unavailable ip={} endpoint={} error={}",
                    key.clientIp(), key.endpoint(), e.getMessage());
            return secondary.increment(key, now);
        }
    }
}
