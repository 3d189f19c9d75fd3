package com.shlokmestry.trafficcontrol.ratelimit;

public record RateLimitDecision(
        Outcome outcome,
        int quota,
        long count,
        String reason
) {

    public enum Outcome {
        ADMITTED,
        BLOCKED,
        SUSPICIOUS,
        QUOTA_EXCEEDED
    }

    public static RateLimitDecision admitted(int quota, long count) {
        return new RateLimitDecision(Outcome.ADMITTED, quota, count, null);
    }

    public static RateLimitDecision rejected(Outcome outcome, int quota, long count, String reason) {
        return new RateLimitDecision(outcome, quota, count, reason);
    }

    public boolean limited() {
        return outcome != Outcome.ADMITTED;
    }
}
