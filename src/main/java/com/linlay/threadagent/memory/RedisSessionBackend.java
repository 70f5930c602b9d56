package com.linlay.threadagent.memory;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

public class RedisSessionBackend implements SessionBackend {

    private final StringRedisTemplate redisTemplate;

    public RedisSessionBackend(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        String json = redisTemplate.opsForValue().get(key);
        if (json == null || json.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(json);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }
}
