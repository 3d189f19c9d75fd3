package com.shlokmestry.trafficcontrol.balancer;

import java.util.Arrays;

public enum LoadBalancingStrategy {

    ROUND_ROBIN("round_robin"),
    LEAST_CONNECTIONS("least_connections"),
    WEIGHTED("weighted"),
    RESPONSE_TIME("response_time");

    private final String wireName;

    LoadBalancingStrategy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws UnsupportedStrategyException if {@code name} is not one of the recognised strategy names
     */
    public static LoadBalancingStrategy fromName(String name) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(name))
                .findFirst()
                .orElseThrow(() -> new UnsupportedStrategyException(name));
    }
}
