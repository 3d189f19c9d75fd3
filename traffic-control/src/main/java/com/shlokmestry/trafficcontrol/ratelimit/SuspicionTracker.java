package com.shlokmestry.trafficcontrol.ratelimit;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.springframework.stereotype.Component;

// Scores never decay.
@Component
public class SuspicionTracker {

    private final ConcurrentMap<String, Integer> scores = new ConcurrentHashMap<>();

    public int increment(String ip) {
        return scores.merge(ip, 1, Integer::sum);
    }

    public int score(String ip) {
        return scores.getOrDefault(ip, 0);
    }

    public void reset(String ip) {
        scores.remove(ip);
    }
}
