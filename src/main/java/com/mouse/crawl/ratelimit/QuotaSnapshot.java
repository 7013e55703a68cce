package com.mouse.crawl.ratelimit;

/**
 * Upstream's self-reported quota for one endpoint. {@code reset} is epoch seconds.
 */
public record QuotaSnapshot(int remaining, long reset, int limit) {
}
