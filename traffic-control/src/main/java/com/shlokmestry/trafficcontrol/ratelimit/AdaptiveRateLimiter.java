package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import com.shlokmestry.trafficcontrol.observability.TrafficMetrics;
import com.shlokmestry.trafficcontrol.ratelimit.RateLimitDecision.Outcome;

/**
 * Admission control: per-ip blocks, anomaly scoring and fixed-window quotas per endpoint.
 *
 * <p>Shared-store failures never reach the caller. Counting falls back to process-local state and
 * a request is only ever rejected for a block, an anomaly or an exceeded quota.
 */
public class AdaptiveRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveRateLimiter.class);

    static final String SUSPICIOUS_REASON = "suspicious activity";

    private final RateLimitProperties properties;
    private final BlockList blockList;
    private final WindowCounterStore counters;
    private final RequestHistory history;
    private final AnomalyDetector anomalyDetector;
    private final SuspicionTracker suspicion;
    private final TrafficMetrics metrics;
    private final Clock clock;

    public AdaptiveRateLimiter(
            RateLimitProperties properties,
            BlockList blockList,
            WindowCounterStore counters,
            RequestHistory history,
            AnomalyDetector anomalyDetector,
            SuspicionTracker suspicion,
            TrafficMetrics metrics,
            Clock clock
    ) {
        this.properties = properties;
        this.blockList = blockList;
        this.counters = counters;
        this.history = history;
        this.anomalyDetector = anomalyDetector;
        this.suspicion = suspicion;
        this.metrics = metrics;
        this.clock = clock;
    }

    public boolean isRateLimited(String ip, String endpoint, HttpHeaders headers, Instant now) {
        return decide(new InboundRequest(ip, endpoint, null, headers), now).limited();
    }

    public RateLimitDecision decide(InboundRequest request) {
        return decide(request, clock.instant());
    }

    public RateLimitDecision decide(InboundRequest request, Instant now) {
        String ip = request.clientIp();
        String endpoint = request.path();
        int quota = properties.quotaFor(endpoint);

        if (!properties.enabled()) {
            return RateLimitDecision.admitted(quota, 0);
        }

        if (blockList.isBlocked(ip, now)) {
            return reject(RateLimitDecision.rejected(Outcome.BLOCKED, quota, 0, "blocked"), ip, endpoint);
        }

        ClientKey key = new ClientKey(ip, endpoint);
        int recent = history.recordAndCountRecent(key, now);
        if (anomalyDetector.isSuspicious(ip, endpoint, request.headers(), recent)) {
            int score = suspicion.increment(ip);
            log.warn("Suspicious activity ip={} endpoint={} score={}", ip, endpoint, score);

            if (score >= properties.suspiciousThreshold()) {
                block(ip, SUSPICIOUS_REASON, now);
                return reject(RateLimitDecision.rejected(Outcome.SUSPICIOUS, quota, 0, SUSPICIOUS_REASON), ip, endpoint);
            }
        }

        long count = counters.increment(key, now);
        if (count > quota) {
            String reason = "rate limit exceeded: " + count + "/" + quota;
            block(ip, reason, now);
            return reject(RateLimitDecision.rejected(Outcome.QUOTA_EXCEEDED, quota, count, reason), ip, endpoint);
        }

        RateLimitDecision admitted = RateLimitDecision.admitted(quota, count);
        metrics.decision(admitted);
        return admitted;
    }

    public void unblock(String ip) {
        blockList.unblock(ip);
        log.info("IP unblocked ip={}", ip);
    }

    public void resetSuspicion(String ip) {
        suspicion.reset(ip);
        log.info("Suspicion score reset ip={}", ip);
    }

    public boolean isBlocked(String ip) {
        return blockList.isBlocked(ip, clock.instant());
    }

    public int suspicionScore(String ip) {
        return suspicion.score(ip);
    }

    private void block(String ip, String reason, Instant now) {
        blockList.block(new BlockEntry(ip, reason, now.plus(properties.blockDuration())));
    }

    private RateLimitDecision reject(RateLimitDecision decision, String ip, String endpoint) {
        metrics.decision(decision);
        log.warn("ratelimit reject outcome={} ip={} endpoint={} count={} quota={}",
                decision.outcome(), ip, endpoint, decision.count(), decision.quota());
        return decision;
    }
}
