package com.shlokmestry.trafficcontrol.balancer;

import java.time.Duration;

// null fields are left unchanged
public record NodeStatusUpdate(
        Boolean healthy,
        Duration responseTime,
        Integer connections
) {

    public static NodeStatusUpdate health(boolean healthy) {
        return new NodeStatusUpdate(healthy, null, null);
    }
}
