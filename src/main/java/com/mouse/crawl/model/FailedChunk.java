package com.mouse.crawl.model;

import java.time.LocalDate;

/**
 * Manifest entry for a chunk that never succeeded.
 */
public record FailedChunk(int index, LocalDate since, LocalDate until, String query, String error, int attempts) {

    public static FailedChunk of(Chunk chunk, String query) {
        return new FailedChunk(chunk.getIndex(), chunk.getSince(), chunk.getUntil(), query,
                chunk.getLastError(), chunk.getRetryCount());
    }
}
