package com.shlokmestry.trafficcontrol.balancer;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "traffic.balancer")
public record BalancerProperties(
        @DefaultValue("round_robin") String defaultStrategy,
        @DefaultValue HealthCheck healthCheck
) {

    public BalancerProperties {
        // fail at startup rather than on the first request
        LoadBalancingStrategy.fromName(defaultStrategy);
    }

    /**
     * @param failureThreshold consecutive failed checks after which a node is reported as circuit-broken
     */
    public record HealthCheck(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("/health") String path,
            @DefaultValue("5s") Duration timeout,
            @DefaultValue("3") int failureThreshold
    ) {}
}
