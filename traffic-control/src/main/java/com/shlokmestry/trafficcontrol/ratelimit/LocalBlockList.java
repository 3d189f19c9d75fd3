package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class LocalBlockList implements BlockList {

    private final ConcurrentMap<String, BlockEntry> entries = new ConcurrentHashMap<>();

    @Override
    public boolean isBlocked(String ip, Instant now) {
        BlockEntry entry = entries.get(ip);
        if (entry == null) {
            return false;
        }
        if (entry.isActive(now)) {
            return true;
        }
        entries.remove(ip, entry);
        return false;
    }

    @Override
    public void block(BlockEntry entry) {
        entries.put(entry.ip(), entry);
    }

    @Override
    public void unblock(String ip) {
        entries.remove(ip);
    }
}
