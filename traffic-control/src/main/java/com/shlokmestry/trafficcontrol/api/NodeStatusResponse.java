package com.shlokmestry.trafficcontrol.api;

import java.time.Instant;

import com.shlokmestry.trafficcontrol.balancer.NodeStatus;

public record NodeStatusResponse(
        String url,
        boolean healthy,
        int connections,
        double responseTime,
        Instant lastCheck,
        int weight
) {
    static NodeStatusResponse from(NodeStatus status) {
        return new NodeStatusResponse(
                status.url(),
                status.healthy(),
                status.connections(),
                Seconds.of(status.responseTime()),
                status.lastCheck(),
                status.weight()
        );
    }
}
