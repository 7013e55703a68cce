package com.mouse.crawl.service;

import com.mouse.crawl.enums.TargetType;
import com.mouse.crawl.model.CrawlRequest;
import com.mouse.crawl.model.CrawlResult;
import com.mouse.crawl.model.DateRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Runs a single crawl at startup when {@code crawler.job.target} is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "crawler.job.target")
public class CrawlJobRunner implements CommandLineRunner {

    private final CrawlService crawlService;

    @Value("${crawler.job.target}")
    private String target;

    @Value("${crawler.job.type:USER_FEED}")
    private TargetType targetType;

    @Value("${crawler.job.limit:50}")
    private int limit;

    @Value("${crawler.job.since:}")
    private String since;

    @Value("${crawler.job.until:}")
    private String until;

    @Value("${crawler.job.stop-at-item-id:}")
    private String stopAtItemId;

    /** ISO-8601 instant; the run ends at the first item older than this. */
    @Value("${crawler.job.stop-before:}")
    private String stopBefore;

    @Value("${crawler.job.rotation-enabled:true}")
    private boolean rotationEnabled;

    @Value("${crawler.job.proxy-enabled:true}")
    private boolean proxyEnabled;

    @Override
    public void run(String... args) {
        CrawlRequest.CrawlRequestBuilder builder = CrawlRequest.builder()
                .targetType(targetType)
                .target(target)
                .limit(limit)
                .rotationEnabled(rotationEnabled)
                .proxyEnabled(proxyEnabled);
        if (!since.isBlank() && !until.isBlank()) {
            builder.dateRange(new DateRange(LocalDate.parse(since), LocalDate.parse(until)));
        }
        if (!stopAtItemId.isBlank()) {
            builder.stopAtItemId(stopAtItemId.trim());
        }
        if (!stopBefore.isBlank()) {
            builder.stopBeforeTimestamp(Instant.parse(stopBefore.trim()));
        }

        CrawlResult result = crawlService.crawl(builder.build());
        log.info("[{}] Finished: success={} state={} items={} unrecoveredChunks={}",
                result.getRunId(), result.isSuccess(), result.getState(), result.itemCount(),
                result.getUnrecoveredChunks().size());
        if (result.getError() != null) {
            log.warn("[{}] Error: [{}] {}", result.getRunId(), result.getErrorKind(), result.getError());
        }
    }
}
