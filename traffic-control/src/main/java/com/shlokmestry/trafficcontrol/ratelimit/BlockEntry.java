package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Instant;

public record BlockEntry(String ip, String reason, Instant expiresAt) {

    public boolean isActive(Instant now) {
        return now.isBefore(expiresAt);
    }
}
