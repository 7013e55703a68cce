package com.mouse.crawl.engine;

import com.mouse.crawl.enums.EngineState;
import com.mouse.crawl.enums.FetchMode;
import com.mouse.crawl.model.Chunk;

/**
 * Progress port called synchronously by the engine and the chunk orchestrator.
 */
public interface CrawlObserver {

    default void onPageFetched(String runId, FetchMode mode, int newItems, int totalItems, String cursor) {
    }

    default void onSessionRotated(String runId, String fromSessionId, String toSessionId, String reason) {
    }

    default void onModeSwitched(String runId, FetchMode from, FetchMode to, String reason) {
    }

    default void onChunkStarted(String runId, Chunk chunk, int position, int totalChunks) {
    }

    default void onChunkFinished(String runId, Chunk chunk, boolean success, int totalItems) {
    }

    default void onRunTerminal(String runId, EngineState state, int totalItems, String error) {
    }

    CrawlObserver NO_OP = new CrawlObserver() {
    };
}
