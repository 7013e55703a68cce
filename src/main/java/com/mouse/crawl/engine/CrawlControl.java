package com.mouse.crawl.engine;

/**
 * Cooperative cancellation supplied by the job layer. Polled at every suspension point.
 */
@FunctionalInterface
public interface CrawlControl {

    boolean shouldStop();

    static CrawlControl never() {
        return () -> false;
    }
}
