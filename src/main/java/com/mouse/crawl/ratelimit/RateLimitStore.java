package com.mouse.crawl.ratelimit;

import java.time.Duration;
import java.util.Optional;

/**
 * Counter store shared by every worker that talks to the same upstream.
 */
public interface RateLimitStore {

    /**
     * Atomically counts one request in the current fixed window of {@code key}.
     * The window starts with the first request and lasts {@code windowMs}.
     *
     * @return true while the count is within {@code maxRequests}
     */
    boolean incrementWindow(String key, int maxRequests, long windowMs);

    void saveQuota(String endpoint, QuotaSnapshot snapshot, Duration ttl);

    Optional<QuotaSnapshot> loadQuota(String endpoint);
}
