package com.mouse.crawl.engine;

import com.mouse.crawl.enums.EngineState;
import com.mouse.crawl.enums.FetchMode;
import com.mouse.crawl.model.Chunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingCrawlObserver implements CrawlObserver {

    @Override
    public void onPageFetched(String runId, FetchMode mode, int newItems, int totalItems, String cursor) {
        log.info("[{}] {} page: +{} (total {})", runId, mode, newItems, totalItems);
    }

    @Override
    public void onSessionRotated(String runId, String fromSessionId, String toSessionId, String reason) {
        log.info("[{}] Rotated session {} -> {} ({})", runId, fromSessionId, toSessionId, reason);
    }

    @Override
    public void onModeSwitched(String runId, FetchMode from, FetchMode to, String reason) {
        log.info("[{}] Switched {} -> {}: {}", runId, from, to, reason);
    }

    @Override
    public void onChunkStarted(String runId, Chunk chunk, int position, int totalChunks) {
        log.info("[{}] Chunk {}/{}: {}", runId, position, totalChunks, chunk);
    }

    @Override
    public void onChunkFinished(String runId, Chunk chunk, boolean success, int totalItems) {
        if (success) {
            log.info("[{}] Chunk {} done (total {})", runId, chunk.getLabel(), totalItems);
        } else {
            log.warn("[{}] Chunk {} failed: {}", runId, chunk.getLabel(), chunk.getLastError());
        }
    }

    @Override
    public void onRunTerminal(String runId, EngineState state, int totalItems, String error) {
        if (state == EngineState.DONE_FAILED) {
            log.error("[{}] Run ended {} with {} items: {}", runId, state, totalItems, error);
        } else {
            log.info("[{}] Run ended {} with {} items", runId, state, totalItems);
        }
    }
}
