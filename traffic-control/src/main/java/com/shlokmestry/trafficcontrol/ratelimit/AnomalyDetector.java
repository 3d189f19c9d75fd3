package com.shlokmestry.trafficcontrol.ratelimit;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Cheap request-shape heuristic. A request is suspicious when at least two signals fire.
 * False positives are expected; this is not an authentication mechanism.
 */
@Component
public class AnomalyDetector {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    private static final int SIGNALS_REQUIRED = 2;

    public enum Signal {
        BURST,
        GENERIC_USER_AGENT,
        MISSING_ACCEPT,
        FORWARDED_FOR_MISMATCH
    }

    private final int burstThreshold;
    private final List<String> genericUserAgents;

    public AnomalyDetector(RateLimitProperties properties) {
        this.burstThreshold = properties.burstThreshold();
        this.genericUserAgents = properties.genericUserAgents();
    }

    public boolean isSuspicious(String ip, String endpoint, HttpHeaders headers, int recentRequests) {
        return signals(ip, endpoint, headers, recentRequests).size() >= SIGNALS_REQUIRED;
    }

    public Set<Signal> signals(String ip, String endpoint, HttpHeaders headers, int recentRequests) {
        Set<Signal> fired = EnumSet.noneOf(Signal.class);

        if (recentRequests >= burstThreshold) {
            fired.add(Signal.BURST);
        }

        String userAgent = headers.getFirst(HttpHeaders.USER_AGENT);
        if (userAgent == null || userAgent.isBlank() || genericUserAgents.contains(userAgent.trim().toLowerCase())) {
            fired.add(Signal.GENERIC_USER_AGENT);
        }

        if (headers.getFirst(HttpHeaders.ACCEPT) == null) {
            fired.add(Signal.MISSING_ACCEPT);
        }

        String forwardedFor = headers.getFirst(FORWARDED_FOR);
        if (forwardedFor != null && !forwardedFor.isBlank() && !forwardedFor.trim().equals(ip)) {
            fired.add(Signal.FORWARDED_FOR_MISMATCH);
        }

        return fired;
    }
}
