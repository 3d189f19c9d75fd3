package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "traffic.ratelimit")
public record RateLimitProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("60") int defaultLimit,
        Map<String, Integer> endpointLimits,
        @DefaultValue("60s") Duration window,
        @DefaultValue("30m") Duration blockDuration,
        @DefaultValue("3") int suspiciousThreshold,
        @DefaultValue("10") int burstThreshold,
        @DefaultValue("1s") Duration burstWindow,
        List<String> genericUserAgents,
        List<String> excludedPaths
) {

    public static final Map<String, Integer> DEFAULT_ENDPOINT_LIMITS = Map.of(
            "/api/analyze", 30,
            "/api/analyze-image", 20,
            "/api/health", 120
    );

    public static final List<String> DEFAULT_GENERIC_USER_AGENTS = List.of("python-requests", "curl");

    public static final List<String> DEFAULT_EXCLUDED_PATHS = List.of("/v1/**", "/actuator/**");

    public RateLimitProperties {
        endpointLimits = endpointLimits == null ? DEFAULT_ENDPOINT_LIMITS : Map.copyOf(endpointLimits);
        genericUserAgents = genericUserAgents == null
                ? DEFAULT_GENERIC_USER_AGENTS
                : genericUserAgents.stream().map(String::toLowerCase).toList();
        excludedPaths = excludedPaths == null ? DEFAULT_EXCLUDED_PATHS : List.copyOf(excludedPaths);
        if (window.getSeconds() < 1) {
            throw new IllegalArgumentException("traffic.ratelimit.window must be at least one second");
        }
    }

    public static RateLimitProperties defaults() {
        return new RateLimitProperties(true, 60, null, Duration.ofSeconds(60), Duration.ofMinutes(30),
                3, 10, Duration.ofSeconds(1), null, null);
    }

    public int quotaFor(String endpoint) {
        return endpointLimits.getOrDefault(endpoint, defaultLimit);
    }
}
