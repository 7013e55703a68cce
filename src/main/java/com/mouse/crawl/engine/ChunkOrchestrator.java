package com.mouse.crawl.engine;

import com.mouse.crawl.config.ChunkPolicy;
import com.mouse.crawl.dispatch.OperationRequestFactory;
import com.mouse.crawl.enums.EngineState;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.exception.CrawlConfigurationException;
import com.mouse.crawl.manager.SessionPool;
import com.mouse.crawl.model.Chunk;
import com.mouse.crawl.model.CrawlItem;
import com.mouse.crawl.model.CrawlRequest;
import com.mouse.crawl.model.CrawlResult;
import com.mouse.crawl.model.DateRange;
import com.mouse.crawl.model.FailedChunk;
import com.mouse.crawl.model.Session;
import com.mouse.crawl.utils.DateChunker;
import com.mouse.crawl.utils.QueryComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Historical search over a date range, one pagination run per calendar month.
 *
 * <p>A failed chunk is first retried immediately on a session that has not failed it, then again in up to
 * {@link ChunkPolicy#getMaxGlobalRetries()} global passes once every chunk has had its turn. Chunks that never
 * succeed are reported in the result instead of failing the run. Every attempt carries the ids collected so
 * far, so a retry pages past what an earlier attempt delivered. A stop condition met in any chunk ends the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChunkOrchestrator {

    private final PaginationEngine engine;
    private final SessionPool sessionPool;
    private final OperationRequestFactory requestFactory;
    private final ChunkPolicy policy;

    /**
     * @throws CrawlConfigurationException when the range or query is missing; nothing else escapes
     */
    public CrawlResult run(CrawlRequest request, CrawlControl control, CrawlObserver observer) {
        DateRange range = request.getDateRange();
        if (range == null || range.isEmpty()) {
            throw new CrawlConfigurationException("Historical search needs a non-empty date range");
        }
        if (request.getTarget() == null || request.getTarget().isBlank()) {
            throw new CrawlConfigurationException("Historical search needs a query");
        }

        List<Chunk> chunks = DateChunker.monthly(range, policy.isNewestFirst());
        log.info("[{}] Historical search '{}' over {} in {} chunk(s)", request.getRunId(), request.getTarget(),
                range, chunks.size());

        Map<String, CrawlItem> collected = new LinkedHashMap<>();
        List<Chunk> failed = new ArrayList<>();
        boolean cancelled = false;
        boolean stopReached = false;

        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            if (control.shouldStop()) {
                cancelled = true;
                break;
            }
            if (collected.size() >= request.getLimit()) {
                break;
            }
            observer.onChunkStarted(request.getRunId(), chunk, i + 1, chunks.size());

            PaginationOutcome outcome = runChunk(request, chunk, collected, request.getPreferredSessionId(), control, observer);
            for (int retry = 1; !outcome.isSuccess() && !outcome.isCancelled() && retry <= policy.getMaxChunkRetries(); retry++) {
                chunk.recordFailure(outcome.getError(), outcome.getAttemptedSessionIds());
                Session next = sessionPool.selectUntried(chunk.getFailedSessionIds());
                if (next == null) {
                    next = sessionPool.selectNext(null, null);
                }
                if (next == null) {
                    break;
                }
                log.warn("[{}] Chunk {} failed ({}), immediate retry {} with session {}",
                        request.getRunId(), chunk.getLabel(), outcome.getError(), retry, next.getId());
                outcome = runChunk(request, chunk, collected, next.getId(), control, observer);
            }

            if (outcome.isCancelled()) {
                cancelled = true;
                break;
            }
            if (!outcome.isSuccess()) {
                chunk.recordFailure(outcome.getError(), outcome.getAttemptedSessionIds());
                failed.add(chunk);
            }
            observer.onChunkFinished(request.getRunId(), chunk, outcome.isSuccess(), collected.size());
            if (outcome.isStopReached()) {
                stopReached = true;
                log.info("[{}] Stop condition reached in chunk {}, skipping {} older chunk(s)",
                        request.getRunId(), chunk.getLabel(), chunks.size() - i - 1);
                break;
            }
        }

        int recovered = 0;
        if (!cancelled && !stopReached) {
            for (int pass = 1; pass <= policy.getMaxGlobalRetries() && !failed.isEmpty(); pass++) {
                if (control.shouldStop()) {
                    cancelled = true;
                    break;
                }
                List<Session> active = sessionPool.allActive();
                if (active.isEmpty()) {
                    log.error("[{}] No active sessions left for global retry", request.getRunId());
                    break;
                }
                log.info("[{}] Global retry pass {}/{} over {} chunk(s)", request.getRunId(), pass,
                        policy.getMaxGlobalRetries(), failed.size());

                for (Chunk chunk : new ArrayList<>(failed)) {
                    if (collected.size() >= request.getLimit()) {
                        break;
                    }
                    Session session = pickForPass(active, pass, chunk);
                    PaginationOutcome outcome = runChunk(request, chunk, collected, session.getId(), control, observer);
                    if (outcome.isCancelled()) {
                        cancelled = true;
                        break;
                    }
                    if (outcome.isSuccess()) {
                        failed.remove(chunk);
                        recovered++;
                        log.info("[{}] Chunk {} recovered on pass {} with session {}",
                                request.getRunId(), chunk.getLabel(), pass, session.getId());
                    } else {
                        chunk.recordFailure(outcome.getError(), outcome.getAttemptedSessionIds());
                    }
                    observer.onChunkFinished(request.getRunId(), chunk, outcome.isSuccess(), collected.size());
                    if (outcome.isStopReached()) {
                        stopReached = true;
                        break;
                    }
                }
                if (cancelled || stopReached) {
                    break;
                }
            }
        }

        List<FailedChunk> unrecovered = failed.stream()
                .map(c -> FailedChunk.of(c, QueryComposer.forChunk(request.getTarget(), c)))
                .collect(Collectors.toList());
        if (!unrecovered.isEmpty()) {
            log.warn("[{}] {} chunk(s) unrecovered: {}", request.getRunId(), unrecovered.size(),
                    failed.stream().map(Chunk::getLabel).collect(Collectors.joining(", ")));
        }

        List<CrawlItem> items = new ArrayList<>(collected.values());
        boolean allFailed = !chunks.isEmpty() && unrecovered.size() == chunks.size() && items.isEmpty();
        EngineState state = cancelled ? EngineState.DONE_CANCELLED
                : allFailed ? EngineState.DONE_FAILED
                : EngineState.DONE_SUCCESS;
        observer.onRunTerminal(request.getRunId(), state, items.size(), allFailed ? "every chunk failed" : null);

        return CrawlResult.builder()
                .runId(request.getRunId())
                .success(!cancelled && !allFailed)
                .state(state)
                .items(items)
                .error(allFailed ? "Every chunk failed: " + failed.get(0).getLastError() : null)
                .errorKind(cancelled ? ErrorKind.CANCELLED : allFailed ? ErrorKind.UPSTREAM : null)
                .totalChunks(chunks.size())
                .recoveredChunks(recovered)
                .unrecoveredChunks(unrecovered)
                .build();
    }

    /**
     * Round-robin start by pass number, skipping sessions that already failed this chunk while another exists.
     */
    static Session pickForPass(List<Session> active, int pass, Chunk chunk) {
        int start = (pass - 1) % active.size();
        for (int offset = 0; offset < active.size(); offset++) {
            Session candidate = active.get((start + offset) % active.size());
            if (!chunk.getFailedSessionIds().contains(candidate.getId())) {
                return candidate;
            }
        }
        return active.get(start);
    }

    private PaginationOutcome runChunk(CrawlRequest request, Chunk chunk, Map<String, CrawlItem> collected,
                                       String preferredSessionId, CrawlControl control, CrawlObserver observer) {
        String query = QueryComposer.forChunk(request.getTarget(), chunk);
        PaginationRequest pagination = PaginationRequest.builder()
                .runId(request.getRunId())
                .request(requestFactory.search(query))
                .limit(request.getLimit() - collected.size())
                .knownItemIds(Set.copyOf(collected.keySet()))
                .stopAtItemId(request.getStopAtItemId())
                .stopBeforeTimestamp(request.getStopBeforeTimestamp())
                .rotationEnabled(request.isRotationEnabled())
                .proxyEnabled(request.isProxyEnabled())
                .preferredSessionId(preferredSessionId)
                .chunkIndex(chunk.getIndex())
                .build();

        PaginationOutcome outcome = engine.run(pagination, control, observer);
        // partial items from a failed attempt are still real data
        outcome.getItems().forEach(item -> collected.putIfAbsent(item.getId(), item));
        return outcome;
    }
}
