package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shlokmestry.trafficcontrol.observability.TrafficMetrics;
import com.shlokmestry.trafficcontrol.store.StoreUnavailableException;

/**
 * Writes blocks to both the shared and the local list and treats an ip as blocked if either has it.
 * The shared list is consulted first; when it is unavailable only the local answer counts.
 */
public class LayeredBlockList implements BlockList {

    private static final Logger log = LoggerFactory.getLogger(LayeredBlockList.class);

    private final BlockList shared;
    private final BlockList local;
    private final TrafficMetrics metrics;

    public LayeredBlockList(BlockList shared, BlockList local, TrafficMetrics metrics) {
        this.shared = shared;
        this.local = local;
        this.metrics = metrics;
    }

    @Override
    public boolean isBlocked(String ip, Instant now) {
        try {
            if (shared.isBlocked(ip, now)) {
                return true;
            }
        } catch (StoreUnavailableException e) {
            metrics.storeFallback("is_blocked");
            log.warn("blocklist fallback=local op=is_blocked ip={} error={}", ip, e.getMessage());
        }
        return local.isBlocked(ip, now);
    }

    @Override
    public void block(BlockEntry entry) {
        try {
            shared.block(entry);
        } catch (StoreUnavailableException e) {
            metrics.storeFallback("block");
            log.warn("blocklist fallback=local op=block ip={} error={}", entry.ip(), e.getMessage());
        }
        local.block(entry);
        log.warn("IP blocked ip={} reason=\"{}\" until={}", entry.ip(), entry.reason(), entry.expiresAt());
    }

    @Override
    public void unblock(String ip) {
        try {
            shared.unblock(ip);
        } catch (StoreUnavailableException e) {
            metrics.storeFallback("unblock");
            log.warn("blocklist fallback=local op=unblock ip={} error={}", ip, e.getMessage());
        }
        local.unblock(ip);
    }
}
