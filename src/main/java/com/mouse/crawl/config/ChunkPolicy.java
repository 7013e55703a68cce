package com.mouse.crawl.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ChunkPolicy {

    /** Immediate re-attempts of a failed chunk, each on an untried session. */
    @Builder.Default
    int maxChunkRetries = 1;

    /** Full passes over still-failing chunks after the first pass. */
    @Builder.Default
    int maxGlobalRetries = 2;

    @Builder.Default
    boolean newestFirst = true;

    public static ChunkPolicy defaults() {
        return ChunkPolicy.builder().build();
    }
}
