package com.mouse.crawl.ratelimit;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process store. Atomicity comes from {@link ConcurrentHashMap#compute}.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "crawler.rate-limit.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRateLimitStore implements RateLimitStore {

    private record Window(int count, long expiresAt) {
    }

    private record StoredQuota(QuotaSnapshot snapshot, long expiresAt) {
    }

    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Map<String, StoredQuota> quotas = new ConcurrentHashMap<>();

    @Override
    public boolean incrementWindow(String key, int maxRequests, long windowMs) {
        long now = clock.millis();
        Window window = windows.compute(key, (k, current) ->
                current == null || current.expiresAt() <= now
                        ? new Window(1, now + windowMs)
                        : new Window(current.count() + 1, current.expiresAt()));
        return window.count() <= maxRequests;
    }

    @Override
    public void saveQuota(String endpoint, QuotaSnapshot snapshot, Duration ttl) {
        quotas.put(endpoint, new StoredQuota(snapshot, clock.millis() + ttl.toMillis()));
    }

    @Override
    public Optional<QuotaSnapshot> loadQuota(String endpoint) {
        StoredQuota stored = quotas.get(endpoint);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.expiresAt() <= clock.millis()) {
            quotas.remove(endpoint, stored);
            return Optional.empty();
        }
        return Optional.of(stored.snapshot());
    }
}
