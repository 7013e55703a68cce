package com.mouse.crawl.model;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Health counters shared by sessions and proxies.
 * Counters are atomic so pools can be mutated from several crawl workers at once.
 * Retirement is one-way.
 */
public abstract class HealthTracked {

    private final AtomicInteger usageCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicBoolean retired = new AtomicBoolean(false);

    public abstract String getId();

    public int getUsageCount() {
        return usageCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public boolean isRetired() {
        return retired.get();
    }

    public boolean isActive() {
        return !retired.get();
    }

    /** Usage up, one error forgiven (floor 0), failure streak cleared. */
    public void recordSuccess() {
        usageCount.incrementAndGet();
        errorCount.getAndUpdate(e -> Math.max(0, e - 1));
        consecutiveFailures.set(0);
    }

    /**
     * @return true when this call retired the entry
     */
    public boolean recordFailure(int maxErrorCount, int maxConsecutiveFailures) {
        int errors = errorCount.incrementAndGet();
        int streak = consecutiveFailures.incrementAndGet();
        if (errors >= maxErrorCount || streak >= maxConsecutiveFailures) {
            return retired.compareAndSet(false, true);
        }
        return false;
    }

    public boolean retire() {
        return retired.compareAndSet(false, true);
    }
}
