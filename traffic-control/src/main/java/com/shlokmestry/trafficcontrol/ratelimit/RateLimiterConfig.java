package com.shlokmestry.trafficcontrol.ratelimit;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.shlokmestry.trafficcontrol.observability.TrafficMetrics;
import com.shlokmestry.trafficcontrol.store.KeyValueStore;

@Configuration
public class RateLimiterConfig {

    @Bean
    WindowCounterStore windowCounterStore(
            KeyValueStore store,
            RateLimitProperties properties,
            TrafficMetrics metrics,
            Clock clock
    ) {
        return new FallbackWindowCounterStore(
                new SharedWindowCounterStore(store, properties.window()),
                new LocalWindowCounterStore(properties.window(), clock),
                metrics
        );
    }

    @Bean
    BlockList blockList(KeyValueStore store, RateLimitProperties properties, TrafficMetrics metrics) {
        return new LayeredBlockList(
                new SharedBlockList(store, properties.blockDuration()),
                new LocalBlockList(),
                metrics
        );
    }

    @Bean
    AdaptiveRateLimiter adaptiveRateLimiter(
            RateLimitProperties properties,
            BlockList blockList,
            WindowCounterStore windowCounterStore,
            RequestHistory history,
            AnomalyDetector anomalyDetector,
            SuspicionTracker suspicionTracker,
            TrafficMetrics metrics,
            Clock clock
    ) {
        return new AdaptiveRateLimiter(properties, blockList, windowCounterStore, history,
                anomalyDetector, suspicionTracker, metrics, clock);
    }
}
