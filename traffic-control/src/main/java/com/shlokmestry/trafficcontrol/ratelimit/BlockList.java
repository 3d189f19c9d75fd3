package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Instant;

public interface BlockList {

    boolean isBlocked(String ip, Instant now);

    void block(BlockEntry entry);

    void unblock(String ip);
}
