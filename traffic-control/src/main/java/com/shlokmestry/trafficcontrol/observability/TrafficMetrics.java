package com.shlokmestry.trafficcontrol.observability;

import org.springframework.stereotype.Component;

import com.shlokmestry.trafficcontrol.balancer.LoadBalancingStrategy;
import com.shlokmestry.trafficcontrol.ratelimit.RateLimitDecision;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

@Component
public class TrafficMetrics {

    private final MeterRegistry registry;

    public TrafficMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void decision(RateLimitDecision decision) {
        Counter.builder("trafficcontrol.ratelimit.decisions.total")
                .description("Total rate-limit decisions by outcome")
                .tag("outcome", decision.outcome().name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void storeFallback(String operation) {
        Counter.builder("trafficcontrol.ratelimit.store_fallback.total")
                .description("Shared store calls that fell back to process-local state")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void selection(LoadBalancingStrategy strategy, boolean found) {
        Counter.builder("trafficcontrol.balancer.selections.total")
                .description("Node selections by strategy and result")
                .tag("strategy", strategy.wireName())
                .tag("found", String.valueOf(found))
                .register(registry)
                .increment();
    }
}
