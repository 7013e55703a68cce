package com.mouse.crawl.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

@Data
@Configuration
public class CrawlerConfig {
    private final List<String> browserFlags = Arrays.asList(
            // === Core Stealth Flags ===
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-blink-features=AutomationControlled",
            "--disable-infobars",
            "--disable-extensions",
            "--disable-default-apps",
            "--disable-popup-blocking",
            "--disable-notifications",
            "--mute-audio",
            "--no-first-run",
            "--lang=en-US",
            "--disable-background-timer-throttling",
            "--disable-backgrounding-occluded-windows",
            "--disable-renderer-backgrounding"
    );

    // ==================== IDENTITY POOLS ====================

    @Value("${crawler.session.dir:./cookies}")
    private String sessionDir;

    @Value("${crawler.session.max-error-count:3}")
    private int sessionMaxErrorCount;

    @Value("${crawler.session.max-consecutive-failures:2}")
    private int sessionMaxConsecutiveFailures;

    @Value("${crawler.proxy.dir:./proxy}")
    private String proxyDir;

    @Value("${crawler.proxy.max-error-count:3}")
    private int proxyMaxErrorCount;

    @Value("${crawler.proxy.max-consecutive-failures:2}")
    private int proxyMaxConsecutiveFailures;

    // ==================== RATE LIMITING ====================

    @Value("${crawler.rate-limit.admission.max-requests:50}")
    private int admissionMaxRequests;

    @Value("${crawler.rate-limit.admission.window-ms:60000}")
    private long admissionWindowMs;

    @Value("${crawler.rate-limit.admission.wait-timeout-ms:60000}")
    private long admissionWaitTimeoutMs;

    // ==================== DISPATCH / RETRY ====================

    @Value("${crawler.dispatch.max-attempts:3}")
    private int dispatchMaxAttempts;

    @Value("${crawler.dispatch.initial-backoff-ms:1500}")
    private long dispatchInitialBackoffMs;

    @Value("${crawler.dispatch.backoff-factor:2}")
    private int dispatchBackoffFactor;

    // ==================== UPSTREAM ====================

    @Value("${crawler.upstream.graphql-base-url:https://x.com/i/api/graphql}")
    private String graphqlBaseUrl;

    @Value("${crawler.upstream.bearer-token:}")
    private String bearerToken;

    @Value("${crawler.upstream.user-agent:Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/123.0.0.0 Safari/537.36}")
    private String userAgent;

    @Value("${crawler.upstream.request-timeout-ms:30000}")
    private int requestTimeoutMs;

    @Value("${crawler.upstream.page-size:20}")
    private int pageSize;

    // ==================== PASSIVE CAPTURE ====================

    @Value("${crawler.capture.site-url:https://x.com}")
    private String captureSiteUrl;

    @Value("${crawler.capture.wait-timeout-ms:15000}")
    private long captureWaitTimeoutMs;

    @Value("${crawler.capture.poll-interval-ms:500}")
    private long capturePollIntervalMs;

    @Value("${crawler.capture.headless:true}")
    private boolean captureHeadless;

    // ==================== CHECKPOINTS ====================

    @Value("${crawler.checkpoint.dir:./data/checkpoints}")
    private String checkpointDir;

    // ==================== POLICY ====================

    @Value("${crawler.policy.empty-retries-before-rotation:2}")
    private int emptyRetriesBeforeRotation;

    @Value("${crawler.policy.empty-confirmations-at-cursor:3}")
    private int emptyConfirmationsAtCursor;

    @Value("${crawler.policy.empty-attempts-when-confirmed:3}")
    private int emptyAttemptsWhenConfirmed;

    @Value("${crawler.policy.max-consecutive-empty:5}")
    private int maxConsecutiveEmpty;

    @Value("${crawler.policy.max-consecutive-errors:3}")
    private int maxConsecutiveErrors;

    @Value("${crawler.policy.fallback.min-sessions-tried:2}")
    private int fallbackMinSessionsTried;

    @Value("${crawler.policy.fallback.min-items-collected:500}")
    private int fallbackMinItemsCollected;

    @Value("${crawler.chunk.max-chunk-retries:1}")
    private int maxChunkRetries;

    @Value("${crawler.chunk.max-global-retries:2}")
    private int maxGlobalRetries;

    @Value("${crawler.chunk.newest-first:true}")
    private boolean chunksNewestFirst;

    @Bean
    public PaginationPolicy paginationPolicy() {
        return PaginationPolicy.builder()
                .emptyRetriesBeforeRotation(emptyRetriesBeforeRotation)
                .emptyConfirmationsAtCursor(emptyConfirmationsAtCursor)
                .emptyAttemptsWhenConfirmed(emptyAttemptsWhenConfirmed)
                .maxConsecutiveEmpty(maxConsecutiveEmpty)
                .maxConsecutiveErrors(maxConsecutiveErrors)
                .fallbackMinSessionsTried(fallbackMinSessionsTried)
                .fallbackMinItemsCollected(fallbackMinItemsCollected)
                .build();
    }

    @Bean
    public ChunkPolicy chunkPolicy() {
        return ChunkPolicy.builder()
                .maxChunkRetries(maxChunkRetries)
                .maxGlobalRetries(maxGlobalRetries)
                .newestFirst(chunksNewestFirst)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
