package com.shlokmestry.trafficcontrol.balancer;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable node record. Only touched by {@link LoadBalancer} while holding its lock.
 */
final class NodeState {

    static final int MIN_WEIGHT = 1;
    static final int MAX_WEIGHT = 10;

    final String id;
    final String url;
    int weight;
    int activeConnections;
    Duration lastResponseTime = Duration.ZERO;
    Instant lastHealthCheck;
    boolean healthy = true;

    NodeState(String id, String url, int weight) {
        this.id = id;
        this.url = url;
        this.weight = clampWeight(weight);
    }

    static int clampWeight(int weight) {
        return Math.max(MIN_WEIGHT, Math.min(MAX_WEIGHT, weight));
    }

    boolean isMeasured() {
        return lastResponseTime.compareTo(Duration.ZERO) > 0;
    }

    ServiceNode snapshot() {
        return new ServiceNode(id, url, weight, activeConnections, lastResponseTime, lastHealthCheck, healthy);
    }

    NodeStatus status() {
        return new NodeStatus(url, healthy, activeConnections, lastResponseTime, lastHealthCheck, weight);
    }
}
