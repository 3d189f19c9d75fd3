package com.shlokmestry.trafficcontrol.balancer;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.shlokmestry.trafficcontrol.observability.TrafficMetrics;

/**
 * In-memory registry of backend nodes with pluggable selection.
 *
 * <p>Every registry mutation, selection and snapshot runs under one lock, so selection cursors
 * advance atomically and no caller sees a half-applied update. Nodes are kept in registration
 * order, which is the order every strategy uses to break ties.
 */
@Component
public class LoadBalancer {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    static final Duration FAST_RESPONSE = Duration.ofMillis(100);
    static final Duration SLOW_RESPONSE = Duration.ofSeconds(1);

    private final Map<String, NodeState> nodes = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final TrafficMetrics metrics;

    private long roundRobinCursor;
    private long weightedCursor;

    public LoadBalancer(Clock clock, TrafficMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    public void addNode(String id, String url) {
        addNode(id, url, 1);
    }

    // Replaces any node with the same id.
    public void addNode(String id, String url, int weight) {
        lock.lock();
        try {
            nodes.put(id, new NodeState(id, url, weight));
        } finally {
            lock.unlock();
        }
        log.info("Node registered id={} url={} weight={}", id, url, NodeState.clampWeight(weight));
    }

    public boolean removeNode(String id) {
        boolean removed;
        lock.lock();
        try {
            removed = nodes.remove(id) != null;
        } finally {
            lock.unlock();
        }
        if (removed) {
            log.info("Node deregistered id={}", id);
        }
        return removed;
    }

    public Optional<ServiceNode> getNextNode(String strategy) {
        return getNextNode(LoadBalancingStrategy.fromName(strategy));
    }

    public Optional<ServiceNode> getNextNode(LoadBalancingStrategy strategy) {
        Optional<ServiceNode> selected;
        lock.lock();
        try {
            List<NodeState> healthy = nodes.values().stream().filter(n -> n.healthy).toList();
            if (healthy.isEmpty()) {
                selected = Optional.empty();
            } else {
                NodeState node = switch (strategy) {
                    case ROUND_ROBIN -> roundRobin(healthy);
                    case LEAST_CONNECTIONS -> leastConnections(healthy);
                    case WEIGHTED -> weighted(healthy);
                    case RESPONSE_TIME -> fastestResponse(healthy);
                };
                selected = Optional.of(node.snapshot());
            }
        } finally {
            lock.unlock();
        }
        metrics.selection(strategy, selected.isPresent());
        return selected;
    }

    private NodeState roundRobin(List<NodeState> healthy) {
        int index = (int) (roundRobinCursor % healthy.size());
        roundRobinCursor = index + 1;
        return healthy.get(index);
    }

    private static NodeState leastConnections(List<NodeState> healthy) {
        // min() keeps the first of equal elements, i.e. registry order
        return healthy.stream()
                .min(Comparator.comparingInt(n -> n.activeConnections))
                .orElseThrow();
    }

    private NodeState weighted(List<NodeState> healthy) {
        long totalWeight = healthy.stream().mapToLong(n -> n.weight).sum();
        long point = (weightedCursor % totalWeight) + 1;
        weightedCursor = point;

        long cumulative = 0;
        for (NodeState node : healthy) {
            cumulative += node.weight;
            if (cumulative >= point) {
                return node;
            }
        }
        return healthy.get(healthy.size() - 1);
    }

    private static NodeState fastestResponse(List<NodeState> healthy) {
        NodeState best = null;
        for (NodeState node : healthy) {
            if (!node.isMeasured()) {
                continue;
            }
            if (best == null || node.lastResponseTime.compareTo(best.lastResponseTime) < 0) {
                best = node;
            }
        }
        return best != null ? best : healthy.get(0);
    }

    /**
     * Records a response time and nudges the node weight: faster than 100 ms adds one,
     * slower than one second removes one, within [1, 10].
     *
     * @return {@code false} if no node has this id; nothing is changed in that case
     */
    public boolean updateMetrics(String id, Duration responseTime) {
        lock.lock();
        try {
            NodeState node = nodes.get(id);
            if (node == null) {
                return false;
            }
            node.lastResponseTime = responseTime;
            if (responseTime.compareTo(FAST_RESPONSE) < 0) {
                node.weight = NodeState.clampWeight(node.weight + 1);
            } else if (responseTime.compareTo(SLOW_RESPONSE) > 0) {
                node.weight = NodeState.clampWeight(node.weight - 1);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies the non-null fields of {@code update} and stamps the health-check time.
     *
     * @return {@code false} if no node has this id; nothing is changed in that case
     */
    public boolean updateNodeStatus(String id, NodeStatusUpdate update) {
        boolean healthChanged = false;
        lock.lock();
        try {
            NodeState node = nodes.get(id);
            if (node == null) {
                return false;
            }
            if (update.healthy() != null) {
                healthChanged = node.healthy != update.healthy();
                node.healthy = update.healthy();
            }
            if (update.responseTime() != null) {
                node.lastResponseTime = update.responseTime();
            }
            if (update.connections() != null) {
                node.activeConnections = update.connections();
            }
            node.lastHealthCheck = clock.instant();
        } finally {
            lock.unlock();
        }
        if (healthChanged) {
            log.info("Node health changed id={} healthy={}", id, update.healthy());
        }
        return true;
    }

    public Optional<ServiceNode> getNode(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(nodes.get(id)).map(NodeState::snapshot);
        } finally {
            lock.unlock();
        }
    }

    // registration order
    public Map<String, NodeStatus> getNodeStatus() {
        lock.lock();
        try {
            Map<String, NodeStatus> status = new LinkedHashMap<>();
            nodes.forEach((id, node) -> status.put(id, node.status()));
            return status;
        } finally {
            lock.unlock();
        }
    }
}
