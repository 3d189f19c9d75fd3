package com.shlokmestry.trafficcontrol.balancer;

public class UnsupportedStrategyException extends IllegalArgumentException {
    public UnsupportedStrategyException(String strategy) {
        super("Unsupported load balancing strategy: " + strategy);
    }
}
