package com.shlokmestry.trafficcontrol.api;

public record ClientStatusResponse(
        String ip,
        boolean blocked,
        int suspicionScore
) {}
