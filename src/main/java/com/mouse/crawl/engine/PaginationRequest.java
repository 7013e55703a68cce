package com.mouse.crawl.engine;

import com.mouse.crawl.dispatch.UpstreamRequest;
import com.mouse.crawl.model.Chunk;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Input for one pagination run.
 */
@Value
@Builder(toBuilder = true)
public class PaginationRequest {

    String runId;

    /** Primary operation; ignored when {@link #chunks} is set. */
    UpstreamRequest request;

    /**
     * Builds the narrower fallback request from the oldest collected timestamp.
     * Null when the target has no fallback mode.
     */
    Function<Instant, UpstreamRequest> fallbackFactory;

    /** Optional ordered date slices walked by this run through ADVANCE_CHUNK. */
    @Builder.Default
    List<Chunk> chunks = List.of();

    Function<Chunk, UpstreamRequest> chunkRequestFactory;

    int limit;

    String stopAtItemId;

    Instant stopBeforeTimestamp;

    /**
     * Ids the caller already holds. Pages that only replay them move the cursor without counting as
     * new items or as empty pages.
     */
    @Builder.Default
    Set<String> knownItemIds = Set.of();

    @Builder.Default
    boolean rotationEnabled = true;

    @Builder.Default
    boolean proxyEnabled = true;

    String preferredSessionId;

    /** Reported in checkpoints when the caller runs one chunk per request. */
    Integer chunkIndex;

    public boolean hasFallback() {
        return fallbackFactory != null;
    }

    public boolean isChunked() {
        return chunks != null && !chunks.isEmpty();
    }
}
