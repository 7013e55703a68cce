package com.mouse.crawl.engine;

import com.mouse.crawl.enums.EngineState;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.model.CrawlItem;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class PaginationOutcome {

    EngineState state;

    @Builder.Default
    List<CrawlItem> items = List.of();

    String error;
    ErrorKind errorKind;

    @Builder.Default
    Set<String> attemptedSessionIds = Set.of();

    String lastSessionId;
    String finalCursor;
    boolean fallbackUsed;

    /** A stop-at-id or stop-before-timestamp item was seen; the caller should not look any further. */
    boolean stopReached;

    /** Exhaustion counts as success: an empty range is a valid answer. */
    public boolean isSuccess() {
        return state == EngineState.DONE_SUCCESS || state == EngineState.DONE_EXHAUSTED;
    }

    public boolean isCancelled() {
        return state == EngineState.DONE_CANCELLED;
    }
}
