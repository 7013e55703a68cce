package com.mouse.crawl.service;

import com.mouse.crawl.config.ChunkPolicy;
import com.mouse.crawl.dispatch.OperationRequestFactory;
import com.mouse.crawl.dispatch.RequestDispatcher;
import com.mouse.crawl.engine.ChunkOrchestrator;
import com.mouse.crawl.engine.CrawlControl;
import com.mouse.crawl.engine.CrawlObserver;
import com.mouse.crawl.engine.PaginationEngine;
import com.mouse.crawl.engine.PaginationOutcome;
import com.mouse.crawl.engine.PaginationRequest;
import com.mouse.crawl.enums.EngineState;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.enums.TargetType;
import com.mouse.crawl.exception.CrawlConfigurationException;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.extract.ItemExtractor;
import com.mouse.crawl.manager.SessionPool;
import com.mouse.crawl.model.Chunk;
import com.mouse.crawl.model.CrawlRequest;
import com.mouse.crawl.model.CrawlResult;
import com.mouse.crawl.model.Session;
import com.mouse.crawl.utils.DateChunker;
import com.mouse.crawl.utils.QueryComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for one crawl: validates the request and routes it to a user-feed run, a plain search run,
 * a dated search walked month by month in a single run, or a historical search with per-chunk retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrawlService {

    private final PaginationEngine engine;
    private final ChunkOrchestrator chunkOrchestrator;
    private final RequestDispatcher dispatcher;
    private final ItemExtractor extractor;
    private final SessionPool sessionPool;
    private final OperationRequestFactory requestFactory;
    private final ChunkPolicy chunkPolicy;
    private final CrawlObserver defaultObserver;

    public CrawlResult crawl(CrawlRequest request) {
        return crawl(request, CrawlControl.never(), defaultObserver);
    }

    /**
     * @throws CrawlConfigurationException for an invalid request, before any network call
     */
    public CrawlResult crawl(CrawlRequest request, CrawlControl control, CrawlObserver observer) {
        CrawlRequest validated = validate(request);
        log.info("[{}] Crawl {} '{}' limit={}", validated.getRunId(), validated.getTargetType(),
                validated.getTarget(), validated.getLimit());

        if (validated.getTargetType() == TargetType.HISTORICAL_SEARCH) {
            return chunkOrchestrator.run(validated, control, observer);
        }
        if (validated.getTargetType() == TargetType.SEARCH) {
            return validated.getDateRange() != null
                    ? datedSearch(validated, control, observer)
                    : searchOnce(validated, control, observer);
        }
        return userFeed(validated, control, observer);
    }

    CrawlRequest validate(CrawlRequest request) {
        if (request == null) {
            throw new CrawlConfigurationException("Crawl request is required");
        }
        if (request.getTargetType() == null) {
            throw new CrawlConfigurationException("Target type is required");
        }
        if (request.getTarget() == null || request.getTarget().isBlank()) {
            throw new CrawlConfigurationException("Target identifier is required");
        }
        if (request.getLimit() <= 0) {
            throw new CrawlConfigurationException("Limit must be positive, got " + request.getLimit());
        }
        if (request.getTargetType() == TargetType.HISTORICAL_SEARCH && request.getDateRange() == null) {
            throw new CrawlConfigurationException("Historical search needs a date range");
        }
        if (request.getDateRange() != null && request.getDateRange().isEmpty()) {
            throw new CrawlConfigurationException("Date range is empty: " + request.getDateRange());
        }
        String target = request.getTarget().trim();
        if (request.getTargetType() == TargetType.USER_FEED && target.startsWith("@")) {
            target = target.substring(1);
        }
        String runId = request.getRunId() != null && !request.getRunId().isBlank()
                ? request.getRunId()
                : UUID.randomUUID().toString();
        return request.toBuilder().runId(runId).target(target).build();
    }

    private CrawlResult searchOnce(CrawlRequest request, CrawlControl control, CrawlObserver observer) {
        PaginationRequest pagination = basePagination(request)
                .request(requestFactory.search(request.getTarget()))
                .build();
        return toResult(request.getRunId(), engine.run(pagination, control, observer));
    }

    /**
     * One engine run that advances through the monthly slices itself. A failed slice ends the run with what
     * was collected; {@link TargetType#HISTORICAL_SEARCH} is the variant that retries slices.
     */
    private CrawlResult datedSearch(CrawlRequest request, CrawlControl control, CrawlObserver observer) {
        List<Chunk> chunks = DateChunker.monthly(request.getDateRange(), chunkPolicy.isNewestFirst());
        String query = request.getTarget();
        PaginationRequest pagination = basePagination(request)
                .chunks(chunks)
                .chunkRequestFactory(chunk -> requestFactory.search(QueryComposer.forChunk(query, chunk)))
                .build();
        return toResult(request.getRunId(), engine.run(pagination, control, observer));
    }

    private CrawlResult userFeed(CrawlRequest request, CrawlControl control, CrawlObserver observer) {
        String screenName = request.getTarget();
        String userId;
        try {
            Optional<String> resolved = resolveUserId(screenName, request, control);
            if (resolved.isEmpty()) {
                return failure(request.getRunId(), ErrorKind.NOT_FOUND, "User @" + screenName + " not found");
            }
            userId = resolved.get();
        } catch (CrawlException e) {
            return failure(request.getRunId(), e.getKind(), "Cannot resolve @" + screenName + ": " + e.getMessage());
        }
        log.info("[{}] @{} resolved to {}", request.getRunId(), screenName, userId);

        PaginationRequest pagination = basePagination(request)
                .request(requestFactory.userFeed(userId))
                .fallbackFactory(anchor -> requestFactory.search(
                        QueryComposer.userFallback(screenName, fallbackUntil(anchor))))
                .build();
        return toResult(request.getRunId(), engine.run(pagination, control, observer));
    }

    /** Exclusive upper bound that still covers the anchor's own day. */
    static LocalDate fallbackUntil(Instant anchor) {
        return anchor.atZone(ZoneOffset.UTC).toLocalDate().plusDays(1);
    }

    /**
     * Tries each active session once for credential-related failures; any other failure is surfaced.
     */
    Optional<String> resolveUserId(String screenName, CrawlRequest request, CrawlControl control) {
        Set<String> tried = new HashSet<>();
        Session session = sessionPool.selectNext(request.getPreferredSessionId(), null);
        CrawlException last = null;
        while (session != null) {
            tried.add(session.getId());
            try {
                Optional<String> userId = extractor.extractUserId(dispatcher.dispatch(
                        requestFactory.userLookup(screenName), session, request.isProxyEnabled(), control::shouldStop));
                sessionPool.markGood(session.getId());
                return userId;
            } catch (CrawlException e) {
                last = e;
                if (e.getKind() != ErrorKind.AUTH && e.getKind() != ErrorKind.RATE_LIMIT) {
                    throw e;
                }
                sessionPool.markBad(session.getId(), "user lookup: " + e.getMessage());
                session = request.isRotationEnabled() ? sessionPool.selectUntried(tried) : null;
            }
        }
        if (last != null) {
            throw last;
        }
        throw new CrawlException(ErrorKind.AUTH, "No active session available");
    }

    private static PaginationRequest.PaginationRequestBuilder basePagination(CrawlRequest request) {
        return PaginationRequest.builder()
                .runId(request.getRunId())
                .limit(request.getLimit())
                .stopAtItemId(request.getStopAtItemId())
                .stopBeforeTimestamp(request.getStopBeforeTimestamp())
                .rotationEnabled(request.isRotationEnabled())
                .proxyEnabled(request.isProxyEnabled())
                .preferredSessionId(request.getPreferredSessionId());
    }

    private static CrawlResult toResult(String runId, PaginationOutcome outcome) {
        return CrawlResult.builder()
                .runId(runId)
                .success(outcome.isSuccess())
                .state(outcome.getState())
                .items(outcome.getItems())
                .error(outcome.getError())
                .errorKind(outcome.getErrorKind())
                .build();
    }

    private static CrawlResult failure(String runId, ErrorKind kind, String error) {
        log.error("[{}] {}", runId, error);
        return CrawlResult.builder()
                .runId(runId)
                .success(false)
                .state(kind == ErrorKind.CANCELLED ? EngineState.DONE_CANCELLED : EngineState.DONE_FAILED)
                .error(error)
                .errorKind(kind)
                .build();
    }
}
