package com.mouse.crawl.capture;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.BooleanSupplier;

/**
 * Browser-mediated access to an operation that cannot be requested directly.
 * The client drives a real page and returns the upstream payload it intercepted.
 */
public interface PassiveCaptureClient extends AutoCloseable {

    /**
     * Opens a fresh result page for {@code query}. Repeating the current query continues it instead.
     */
    JsonNode startNewQuery(String query, BooleanSupplier shouldStop);

    /** Triggers the page's "load more" and waits for the next payload of the current query. */
    JsonNode continueQuery(BooleanSupplier shouldStop);

    /** Null until the first {@link #startNewQuery}. */
    String currentQuery();

    /** Tears the browser down; the next query starts a new one. */
    void restart();

    @Override
    void close();
}
