package com.shlokmestry.trafficcontrol.balancer;

import java.time.Duration;
import java.time.Instant;

public record ServiceNode(
        String id,
        String url,
        int weight,
        int activeConnections,
        Duration lastResponseTime,  // ZERO until reported
        Instant lastHealthCheck,    // null until the first status update
        boolean healthy
) {}
