package com.mouse.crawl.ratelimit;

import com.mouse.crawl.utils.CancellableSleeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Fixed-window admission control plus a delay derived from the upstream's quota headers.
 * Both are advisory: a failing counter store never blocks a request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimiter {

    static final long DEFAULT_DELAY_MS = 2_000;
    static final long LOW_DELAY_MS = 5_000;
    static final long CRITICAL_DELAY_MS = 10_000;
    static final int LOW_REMAINING_THRESHOLD = 50;
    static final int CRITICAL_REMAINING_THRESHOLD = 10;
    static final long MIN_QUOTA_TTL_SECONDS = 60;
    static final long SLOT_POLL_MS = 1_000;

    private final RateLimitStore store;
    private final CancellableSleeper sleeper;
    private final Clock clock;

    public boolean tryAcquire(String key, int maxRequests, long windowMs) {
        try {
            return store.incrementWindow(key, maxRequests, windowMs);
        } catch (RuntimeException e) {
            log.error("Admission check failed for {}, allowing request: {}", key, e.getMessage());
            return true;
        }
    }

    /**
     * Polls {@link #tryAcquire} once a second.
     *
     * @return false on timeout or cancellation
     */
    public boolean waitForSlot(String key, int maxRequests, long windowMs, long maxWaitMs, BooleanSupplier shouldStop) {
        long start = clock.millis();
        while (clock.millis() - start < maxWaitMs) {
            if (tryAcquire(key, maxRequests, windowMs)) {
                return true;
            }
            log.debug("No admission slot for {}, retrying in {}ms", key, SLOT_POLL_MS);
            if (!sleeper.sleep(SLOT_POLL_MS, shouldStop)) {
                return false;
            }
        }
        return false;
    }

    /**
     * Stores the quota until its reset time (at least one minute). Incomplete headers are ignored.
     *
     * @param reset epoch seconds
     */
    public void updateFromHeaders(String endpoint, Integer remaining, Long reset, Integer limit) {
        if (remaining == null || reset == null || remaining < 0 || reset <= 0) {
            return;
        }
        long nowSeconds = clock.millis() / 1000;
        long ttl = Math.max(reset - nowSeconds, MIN_QUOTA_TTL_SECONDS);
        try {
            store.saveQuota(endpoint, new QuotaSnapshot(remaining, reset, limit == null ? 0 : limit), Duration.ofSeconds(ttl));
            log.debug("Quota for {}: remaining={} reset={} limit={}", endpoint, remaining, reset, limit);
        } catch (RuntimeException e) {
            log.error("Failed to store quota for {}: {}", endpoint, e.getMessage());
        }
    }

    /** Milliseconds to wait before the next request to {@code endpoint}. */
    public long getDelay(String endpoint) {
        Optional<QuotaSnapshot> quota;
        try {
            quota = store.loadQuota(endpoint);
        } catch (RuntimeException e) {
            log.error("Failed to read quota for {}: {}", endpoint, e.getMessage());
            return DEFAULT_DELAY_MS;
        }
        if (quota.isEmpty()) {
            return DEFAULT_DELAY_MS;
        }

        QuotaSnapshot info = quota.get();
        long nowSeconds = clock.millis() / 1000;
        if (info.remaining() <= 0 && info.reset() > nowSeconds) {
            long wait = (info.reset() - nowSeconds + 1) * 1000;
            log.warn("Quota exhausted for {}, waiting {}ms", endpoint, wait);
            return wait;
        }
        if (info.remaining() < CRITICAL_REMAINING_THRESHOLD) {
            log.warn("Quota critical for {}: {} remaining", endpoint, info.remaining());
            return CRITICAL_DELAY_MS;
        }
        if (info.remaining() < LOW_REMAINING_THRESHOLD) {
            log.info("Quota low for {}: {} remaining", endpoint, info.remaining());
            return LOW_DELAY_MS;
        }
        return DEFAULT_DELAY_MS;
    }
}
