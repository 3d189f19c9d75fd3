package com.shlokmestry.trafficcontrol.balancer;

import java.time.Duration;
import java.time.Instant;

public record NodeStatus(
        String url,
        boolean healthy,
        int connections,
        Duration responseTime,
        Instant lastCheck,
        int weight
) {}
