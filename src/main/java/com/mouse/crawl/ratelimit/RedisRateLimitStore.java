package com.mouse.crawl.ratelimit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed store so every worker process shares one admission window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "crawler.rate-limit.store", havingValue = "redis")
public class RedisRateLimitStore implements RateLimitStore {

    static final String WINDOW_PREFIX = "crawler:window:";
    static final String QUOTA_PREFIX = "crawler:quota:";

    // Lua false becomes a nil reply, so answer 1/0
    static final RedisScript<Long> INCREMENT_WINDOW = new DefaultRedisScript<>(
            "local count = redis.call('INCR', KEYS[1])\n"
                    + "if count == 1 then redis.call('PEXPIRE', KEYS[1], ARGV[2]) end\n"
                    + "if count <= tonumber(ARGV[1]) then return 1 else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public boolean incrementWindow(String key, int maxRequests, long windowMs) {
        Long admitted = redisTemplate.execute(INCREMENT_WINDOW, List.of(WINDOW_PREFIX + key),
                String.valueOf(maxRequests), String.valueOf(windowMs));
        return admitted != null && admitted == 1L;
    }

    @Override
    public void saveQuota(String endpoint, QuotaSnapshot snapshot, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(QUOTA_PREFIX + endpoint, objectMapper.writeValueAsString(snapshot), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise quota for " + endpoint, e);
        }
    }

    @Override
    public Optional<QuotaSnapshot> loadQuota(String endpoint) {
        String json = redisTemplate.opsForValue().get(QUOTA_PREFIX + endpoint);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, QuotaSnapshot.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable quota for {}: {}", endpoint, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
