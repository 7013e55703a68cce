package com.mouse.crawl.model;

import com.mouse.crawl.enums.TargetType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Crawl configuration surface handed over by the job layer.
 */
@Value
@Builder(toBuilder = true)
public class CrawlRequest {

    String runId;
    TargetType targetType;

    /** Screen name for user feeds, query text for searches. */
    String target;

    @Builder.Default
    int limit = 50;

    DateRange dateRange;

    String stopAtItemId;

    /** Run ends at the first item older than this instant. */
    Instant stopBeforeTimestamp;

    @Builder.Default
    boolean rotationEnabled = true;

    @Builder.Default
    boolean proxyEnabled = true;

    String preferredSessionId;
}
