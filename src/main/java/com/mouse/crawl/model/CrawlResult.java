package com.mouse.crawl.model;

import com.mouse.crawl.enums.EngineState;
import com.mouse.crawl.enums.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CrawlResult {

    String runId;
    boolean success;
    EngineState state;

    @Builder.Default
    List<CrawlItem> items = List.of();

    String error;
    ErrorKind errorKind;

    int totalChunks;
    int recoveredChunks;

    @Builder.Default
    List<FailedChunk> unrecoveredChunks = List.of();

    public int itemCount() {
        return items.size();
    }
}
