package com.mouse.crawl.capture;

import com.fasterxml.jackson.databind.JsonNode;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.utils.CancellableSleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Query bookkeeping and the bounded wait for an intercepted payload.
 * Subclasses drive the page and feed captured payloads through {@link #onCaptured}.
 */
@Slf4j
public abstract class AbstractPassiveCaptureClient implements PassiveCaptureClient {

    protected final String operationName;
    private final long waitTimeoutMs;
    private final long pollIntervalMs;
    private final CancellableSleeper sleeper;
    private final Clock clock;

    private final ConcurrentLinkedQueue<JsonNode> captured = new ConcurrentLinkedQueue<>();
    private final AtomicReference<CrawlException> captureFailure = new AtomicReference<>();

    private String currentQuery;
    private int pagesDelivered;
    private boolean started;

    protected AbstractPassiveCaptureClient(String operationName, long waitTimeoutMs, long pollIntervalMs,
                                           CancellableSleeper sleeper, Clock clock) {
        this.operationName = operationName;
        this.waitTimeoutMs = waitTimeoutMs;
        this.pollIntervalMs = pollIntervalMs;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public synchronized JsonNode startNewQuery(String query, BooleanSupplier shouldStop) {
        if (Objects.equals(query, currentQuery) && pagesDelivered > 0) {
            log.debug("Query '{}' already open, continuing instead", query);
            return continueQuery(shouldStop);
        }
        ensureStarted();
        clearCaptured();
        currentQuery = query;
        pagesDelivered = 0;
        log.info("Capture: new query '{}'", query);
        navigateToQuery(query);
        return awaitCapture(shouldStop);
    }

    @Override
    public synchronized JsonNode continueQuery(BooleanSupplier shouldStop) {
        if (currentQuery == null) {
            throw new CrawlException(ErrorKind.UNKNOWN, "continueQuery called before any query was started");
        }
        ensureStarted();
        clearCaptured();
        triggerLoadMore();
        return awaitCapture(shouldStop);
    }

    @Override
    public synchronized String currentQuery() {
        return currentQuery;
    }

    @Override
    public synchronized void restart() {
        log.warn("Restarting capture for {}", operationName);
        shutdownQuietly();
        currentQuery = null;
        pagesDelivered = 0;
        clearCaptured();
    }

    @Override
    public synchronized void close() {
        shutdownQuietly();
    }

    /** Called from the page's response listener. */
    protected void onCaptured(JsonNode payload) {
        captured.offer(payload);
    }

    protected void onCaptureFailed(CrawlException failure) {
        captureFailure.compareAndSet(null, failure);
    }

    /**
     * Waits between polls. Drivers that dispatch events only while the caller is inside them override this.
     *
     * @return false if cancelled
     */
    protected boolean pause(long millis, BooleanSupplier shouldStop) {
        return sleeper.sleep(millis, shouldStop);
    }

    private JsonNode awaitCapture(BooleanSupplier shouldStop) {
        long deadline = clock.millis() + waitTimeoutMs;
        while (true) {
            CrawlException failure = captureFailure.getAndSet(null);
            if (failure != null) {
                throw failure;
            }
            JsonNode payload = captured.poll();
            if (payload != null) {
                pagesDelivered++;
                return payload;
            }
            if (clock.millis() >= deadline) {
                throw new CrawlException(ErrorKind.TIMEOUT,
                        "No " + operationName + " response captured within " + waitTimeoutMs + "ms",
                        true, null, operationName, null);
            }
            if (!pause(pollIntervalMs, shouldStop)) {
                throw CrawlException.cancelled("waiting for " + operationName + " capture");
            }
        }
    }

    private void ensureStarted() {
        if (!started) {
            start();
            started = true;
        }
    }

    private void shutdownQuietly() {
        if (!started) {
            return;
        }
        started = false;
        try {
            shutdown();
        } catch (RuntimeException e) {
            log.warn("Error while shutting down capture for {}: {}", operationName, e.getMessage());
        }
    }

    private void clearCaptured() {
        captured.clear();
        captureFailure.set(null);
    }

    protected abstract void start();

    protected abstract void navigateToQuery(String query);

    protected abstract void triggerLoadMore();

    protected abstract void shutdown();
}
