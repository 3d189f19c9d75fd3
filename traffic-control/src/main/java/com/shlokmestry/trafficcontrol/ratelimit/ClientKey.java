package com.shlokmestry.trafficcontrol.ratelimit;

public record ClientKey(String clientIp, String endpoint) {}
