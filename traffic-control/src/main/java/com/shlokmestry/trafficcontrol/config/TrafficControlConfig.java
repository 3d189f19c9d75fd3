package com.shlokmestry.trafficcontrol.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.shlokmestry.trafficcontrol.store.KeyValueStore;
import com.shlokmestry.trafficcontrol.store.RedisKeyValueStore;
import com.shlokmestry.trafficcontrol.store.UnavailableKeyValueStore;

@Configuration
public class TrafficControlConfig {

    private static final Logger log = LoggerFactory.getLogger(TrafficControlConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    KeyValueStore keyValueStore(StoreProperties properties, ObjectProvider<StringRedisTemplate> redis) {
        StringRedisTemplate template = redis.getIfAvailable();
        if (!properties.sharedEnabled() || template == null) {
            log.warn("Shared store disabled; rate limiting runs on process-local state only");
            return new UnavailableKeyValueStore();
        }
        return new RedisKeyValueStore(template);
    }
}
