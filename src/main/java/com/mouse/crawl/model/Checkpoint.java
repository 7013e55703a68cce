package com.mouse.crawl.model;

import com.mouse.crawl.enums.FetchMode;

import java.time.Instant;

public record Checkpoint(String cursor,
                         FetchMode mode,
                         int accumulatedCount,
                         String lastItemId,
                         String sessionId,
                         Integer chunkIndex,
                         Instant savedAt) {
}
