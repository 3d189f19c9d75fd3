package com.shlokmestry.trafficcontrol.api;

import java.time.Instant;

import com.shlokmestry.trafficcontrol.balancer.ServiceNode;

public record NodeResponse(
        String id,
        String url,
        int weight,
        int activeConnections,
        double lastResponseTimeSeconds,
        Instant lastHealthCheck,
        boolean healthy
) {
    static NodeResponse from(ServiceNode node) {
        return new NodeResponse(
                node.id(),
                node.url(),
                node.weight(),
                node.activeConnections(),
                Seconds.of(node.lastResponseTime()),
                node.lastHealthCheck(),
                node.healthy()
        );
    }
}
