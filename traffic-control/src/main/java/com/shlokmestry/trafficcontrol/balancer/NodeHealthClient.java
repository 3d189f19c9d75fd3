package com.shlokmestry.trafficcontrol.balancer;

@FunctionalInterface
public interface NodeHealthClient {

    boolean isHealthy(String url);
}
