package com.shlokmestry.trafficcontrol.ratelimit;

import org.springframework.http.HttpHeaders;

public record InboundRequest(
        String clientIp,
        String path,
        String method,
        HttpHeaders headers
) {
    public InboundRequest {
        headers = headers == null ? HttpHeaders.EMPTY : headers;
    }
}
