package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Duration;
import java.time.Instant;

public interface WindowCounterStore {

    // throws StoreUnavailableException when the backing store cannot be reached
    long increment(ClientKey key, Instant now);

    static long windowIndex(Instant instant, Duration window) {
        return Math.floorDiv(instant.getEpochSecond(), window.getSeconds());
    }
}
