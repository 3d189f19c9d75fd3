package com.shlokmestry.trafficcontrol.store;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import org.springframework.data.redis.core.StringRedisTemplate;

public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redis;

    public RedisKeyValueStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(call("exists", () -> redis.hasKey(key)));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(call("get", () -> redis.opsForValue().get(key)));
    }

    @Override
    public long incr(String key) {
        Long count = call("incr", () -> redis.opsForValue().increment(key));
        if (count == null) {
            // Only happens inside a pipeline or transaction.
            throw new StoreUnavailableException("Redis incr returned no value for key=" + key);
        }
        return count;
    }

    @Override
    public void expire(String key, Duration ttl) {
        call("expire", () -> redis.expire(key, ttl));
    }

    @Override
    public void setex(String key, Duration ttl, String value) {
        call("setex", () -> {
            redis.opsForValue().set(key, value, ttl);
            return Boolean.TRUE;
        });
    }

    @Override
    public void delete(String key) {
        call("delete", () -> redis.delete(key));
    }

    private static <T> T call(String op, Supplier<T> command) {
        try {
            return command.get();
        } catch (Exception e) {
            throw new StoreUnavailableException("Redis " + op + " failed", e);
        }
    }
}
