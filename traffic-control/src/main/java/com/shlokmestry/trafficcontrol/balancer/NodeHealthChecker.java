package com.shlokmestry.trafficcontrol.balancer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically checks every registered node and feeds the result into the balancer.
 */
@Component
@ConditionalOnProperty(prefix = "traffic.balancer.health-check", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NodeHealthChecker {

    private static final Logger log = LoggerFactory.getLogger(NodeHealthChecker.class);

    private final LoadBalancer balancer;
    private final NodeHealthClient client;
    private final String healthPath;
    private final int failureThreshold;
    private final Map<String, Integer> consecutiveFailures = new ConcurrentHashMap<>();

    public NodeHealthChecker(LoadBalancer balancer, NodeHealthClient client, BalancerProperties properties) {
        this.balancer = balancer;
        this.client = client;
        this.healthPath = properties.healthCheck().path();
        this.failureThreshold = properties.healthCheck().failureThreshold();
    }

    @Scheduled(
            fixedDelayString = "${traffic.balancer.health-check.interval:PT30S}",
            initialDelayString = "${traffic.balancer.health-check.interval:PT30S}"
    )
    public void checkAll() {
        Map<String, NodeStatus> nodes = balancer.getNodeStatus();
        consecutiveFailures.keySet().retainAll(nodes.keySet());
        nodes.forEach(this::check);
    }

    void check(String id, NodeStatus node) {
        boolean healthy;
        try {
            healthy = client.isHealthy(stripTrailingSlash(node.url()) + healthPath);
        } catch (RuntimeException e) {
            log.warn("Health check errored id={} url={} error={}", id, node.url(), e.toString());
            healthy = false;
        }
        balancer.updateNodeStatus(id, NodeStatusUpdate.health(healthy));

        if (healthy) {
            consecutiveFailures.remove(id);
            return;
        }
        int failures = consecutiveFailures.merge(id, 1, Integer::sum);
        if (failures == failureThreshold) {
            log.warn("Node circuit broken id={} url={} consecutiveFailures={}", id, node.url(), failures);
        } else {
            log.info("Health check failed id={} url={} consecutiveFailures={}", id, node.url(), failures);
        }
    }

    int failures(String id) {
        return consecutiveFailures.getOrDefault(id, 0);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
