package com.mouse.crawl.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.mouse.crawl.checkpoint.CheckpointSink;
import com.mouse.crawl.config.PaginationPolicy;
import com.mouse.crawl.dispatch.RequestDispatcher;
import com.mouse.crawl.dispatch.UpstreamRequest;
import com.mouse.crawl.enums.EngineState;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.enums.FetchMode;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.extract.ItemExtractor;
import com.mouse.crawl.manager.SessionPool;
import com.mouse.crawl.model.Checkpoint;
import com.mouse.crawl.model.Chunk;
import com.mouse.crawl.model.PageResult;
import com.mouse.crawl.model.Session;
import com.mouse.crawl.utils.CancellableSleeper;
import com.mouse.crawl.utils.ErrorClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;

/**
 * Cursor-driven fetch loop for one target.
 *
 * <p>Each iteration sends the current mode's cursor, accumulates unseen items and decides whether to
 * keep paginating, rotate the session, switch to the fallback query, advance to the next chunk or stop.
 * A page with no new items and no new cursor is the only end-of-stream signal, so it is only believed
 * after enough distinct sessions have seen the same position empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaginationEngine {

    private final RequestDispatcher dispatcher;
    private final ItemExtractor extractor;
    private final SessionPool sessionPool;
    private final CheckpointSink checkpointSink;
    private final CancellableSleeper sleeper;
    private final PaginationPolicy policy;
    private final Clock clock;

    public PaginationOutcome run(PaginationRequest request, CrawlControl control, CrawlObserver observer) {
        CrawlRunState state = new CrawlRunState(request.getRunId(), request.getLimit(),
                request.getStopAtItemId(), request.getStopBeforeTimestamp(), request.getKnownItemIds());

        if (request.isChunked()) {
            state.setChunkIndex(0);
            state.setCurrentRequest(request.getChunkRequestFactory().apply(request.getChunks().get(0)));
        } else {
            state.setCurrentRequest(Objects.requireNonNull(request.getRequest(), "request"));
        }

        Session first = sessionPool.selectNext(request.getPreferredSessionId(), null);
        if (first == null) {
            state.fail("No active session available", ErrorKind.AUTH);
            return finish(request, state, observer);
        }
        state.useSession(first);
        log.info("[{}] Starting {} with session {} (limit {})", request.getRunId(),
                state.getCurrentRequest().operation().getOperationName(), first.getId(), request.getLimit());

        while (!state.getState().isTerminal()) {
            if (control.shouldStop()) {
                state.setState(EngineState.DONE_CANCELLED);
                break;
            }
            if (state.limitReached()) {
                state.setState(EngineState.DONE_SUCCESS);
                break;
            }
            switch (state.getState()) {
                case FETCH_PRIMARY:
                case FETCH_FALLBACK:
                    fetchPage(request, state, control, observer);
                    break;
                case ROTATE_SESSION:
                    rotateSession(request, state, control, observer);
                    break;
                case ADVANCE_CHUNK:
                    advanceChunk(request, state, observer);
                    break;
                default:
                    throw new IllegalStateException("Unhandled state " + state.getState());
            }
        }
        return finish(request, state, observer);
    }

    // ================================================================= fetch

    private void fetchPage(PaginationRequest request, CrawlRunState state, CrawlControl control, CrawlObserver observer) {
        Session session = state.getCurrentSession();
        if (session.isRetired() && request.isRotationEnabled()) {
            requestRotation(state, "session " + session.getId() + " retired");
            return;
        }

        String sentCursor = state.activeCursor();
        UpstreamRequest upstream = state.getCurrentRequest().withCursor(sentCursor);
        PageResult page;
        try {
            JsonNode payload = dispatcher.dispatch(upstream, session, request.isProxyEnabled(), control::shouldStop);
            page = extractor.extractPage(payload);
        } catch (CrawlException e) {
            handleError(request, state, e, control);
            return;
        } catch (RuntimeException e) {
            handleError(request, state, ErrorClassifier.toCrawlException(e, upstream.operation().getOperationName()), control);
            return;
        }

        int added = state.accumulate(page.items());
        String next = page.nextCursor();
        boolean cursorAdvanced = next != null && !next.equals(sentCursor);

        state.resetErrors();
        sessionPool.markGood(session.getId());
        if (next != null) {
            state.advanceCursor(next);
        }
        log.debug("[{}] {} cursor={} -> {} items={} new={}", request.getRunId(), state.getMode(), sentCursor, next,
                page.items().size(), added);
        saveCheckpoint(request, state);
        observer.onPageFetched(request.getRunId(), state.getMode(), added, state.itemCount(), state.activeCursor());

        if (state.isStopReached()) {
            log.info("[{}] Stop condition reached after {} items", request.getRunId(), state.itemCount());
            state.setState(EngineState.DONE_SUCCESS);
            return;
        }
        if (state.limitReached()) {
            state.setState(EngineState.DONE_SUCCESS);
            return;
        }

        if (added > 0) {
            state.recordProgress();
            if (!cursorAdvanced && canSwitchToFallback(request, state)
                    && state.itemCount() > policy.getFallbackMinItemsCollected()) {
                switchToFallback(request, state, observer,
                        "cursor stalled after " + state.itemCount() + " items (depth limit)");
                return;
            }
            pause(policy.getPageDelayMs(), policy.getPageDelayJitterMs(), control);
            return;
        }

        if (cursorAdvanced && state.getReplayedOnLastPage() > 0 && state.recordReplayPage()) {
            // walking back over items an earlier attempt already delivered
            pause(policy.getPageDelayMs(), policy.getPageDelayJitterMs(), control);
            return;
        }
        if (cursorAdvanced) {
            // only duplicates, but the upstream moved on
            int stalled = state.recordStalledPage();
            if (stalled >= policy.getMaxConsecutiveEmpty()) {
                log.warn("[{}] {} pages in a row without new items", request.getRunId(), stalled);
                endOfStream(request, state);
                return;
            }
            pause(policy.getPageDelayMs(), policy.getPageDelayJitterMs(), control);
            return;
        }

        handleEmptyPage(request, state, control, observer);
    }

    /**
     * Zero new items and the cursor did not move. Rotate to rule out a session-specific gap before
     * believing the stream is over.
     */
    private void handleEmptyPage(PaginationRequest request, CrawlRunState state, CrawlControl control,
                                 CrawlObserver observer) {
        if (canSwitchToFallback(request, state)
                && state.itemCount() > 0
                && state.getAttemptedSessionIds().size() >= policy.getFallbackMinSessionsTried()) {
            switchToFallback(request, state, observer,
                    "empty page after " + state.getAttemptedSessionIds().size() + " sessions");
            return;
        }

        int sessionsAtCursor = state.recordEmptyAtCurrentPosition();
        int consecutiveEmpty = state.getConsecutiveEmpty();
        boolean untriedLeft = request.isRotationEnabled()
                && sessionPool.selectUntried(state.getAttemptedSessionIds()) != null;
        boolean likelyRealEnd = sessionsAtCursor >= policy.getEmptyConfirmationsAtCursor() || !untriedLeft;

        log.warn("[{}] Empty page at {} cursor (consecutive={}, sessions seen empty={}, untried left={})",
                request.getRunId(), state.getMode(), consecutiveEmpty, sessionsAtCursor, untriedLeft);

        if ((likelyRealEnd && consecutiveEmpty >= policy.getEmptyAttemptsWhenConfirmed())
                || consecutiveEmpty >= policy.getMaxConsecutiveEmpty()) {
            endOfStream(request, state);
            return;
        }
        if (!likelyRealEnd && consecutiveEmpty >= policy.getEmptyRetriesBeforeRotation()) {
            requestRotation(state, "empty page seen by " + sessionsAtCursor + " session(s)");
            return;
        }
        pause(policy.getEmptyRetryDelayMs(), policy.getDelayJitterMs(), control);
    }

    private void endOfStream(PaginationRequest request, CrawlRunState state) {
        if (request.isChunked() && state.getChunkIndex() + 1 < request.getChunks().size()) {
            state.setState(EngineState.ADVANCE_CHUNK);
            return;
        }
        log.info("[{}] Pagination exhausted in {} mode with {} items", request.getRunId(), state.getMode(), state.itemCount());
        state.setState(EngineState.DONE_EXHAUSTED);
    }

    // ================================================================= errors

    private void handleError(PaginationRequest request, CrawlRunState state, CrawlException e, CrawlControl control) {
        ErrorKind kind = e.getKind();
        String sessionId = state.currentSessionId();
        int errors = state.recordError(e.getMessage(), kind);
        log.warn("[{}] {} error on session {} ({} in a row): {}", request.getRunId(), kind, sessionId, errors, e.getMessage());

        switch (kind) {
            case CANCELLED:
                state.setState(EngineState.DONE_CANCELLED);
                return;
            case NOT_FOUND:
            case DATA_EXTRACTION:
            case CONFIG:
                state.fail(e.getMessage(), kind);
                return;
            case AUTH:
            case RATE_LIMIT:
                sessionPool.markBad(sessionId, kind + ": " + e.getMessage());
                rotateOrRetry(request, state, kind.name().toLowerCase() + " error", control, true);
                return;
            case TIMEOUT:
            case NETWORK:
                rotateOrRetry(request, state, kind.name().toLowerCase() + " error", control, true);
                return;
            case BROWSER_CRASHED:
                dispatcher.restartCapture(sessionId);
                rotateOrRetry(request, state, "browser crashed " + errors + " times", control,
                        errors >= policy.getMaxConsecutiveErrors());
                return;
            default:
                rotateOrRetry(request, state, errors + " consecutive errors", control,
                        errors >= policy.getMaxConsecutiveErrors());
        }
    }

    private void rotateOrRetry(PaginationRequest request, CrawlRunState state, String reason, CrawlControl control,
                               boolean rotate) {
        if (rotate && request.isRotationEnabled()) {
            requestRotation(state, reason);
            return;
        }
        if (state.getConsecutiveErrors() >= policy.getMaxConsecutiveErrors() && !request.isRotationEnabled()) {
            state.fail(state.getLastError(), state.getLastErrorKind());
            return;
        }
        pause(policy.getErrorRetryDelayMs(), policy.getDelayJitterMs(), control);
    }

    // ================================================================= rotation

    private void requestRotation(CrawlRunState state, String reason) {
        state.setPendingRotationReason(reason);
        state.setState(EngineState.ROTATE_SESSION);
    }

    /** Same cursor, same mode, next untried session. */
    private void rotateSession(PaginationRequest request, CrawlRunState state, CrawlControl control,
                               CrawlObserver observer) {
        String from = state.currentSessionId();
        String reason = state.getPendingRotationReason();
        Session next = sessionPool.selectUntried(state.getAttemptedSessionIds());

        if (next == null) {
            if (canSwitchToFallback(request, state)
                    && state.itemCount() >= policy.getFallbackOnSessionExhaustionMinItems()) {
                Session any = sessionPool.selectNext(null, null);
                if (any != null) {
                    state.useSession(any);
                    switchToFallback(request, state, observer, "all sessions tried in primary mode");
                    return;
                }
            }
            String error = "All sessions exhausted (" + reason + ")"
                    + (state.getLastError() != null ? ": " + state.getLastError() : "");
            state.fail(error, state.getLastErrorKind() != null ? state.getLastErrorKind() : ErrorKind.AUTH);
            return;
        }

        state.useSession(next);
        state.resetErrors();
        state.setState(EngineState.fetching(state.getMode()));
        observer.onSessionRotated(request.getRunId(), from, next.getId(), reason);
        pause(policy.getRotationDelayMs(), policy.getDelayJitterMs(), control);
    }

    // ================================================================= mode / chunk

    private boolean canSwitchToFallback(PaginationRequest request, CrawlRunState state) {
        return request.hasFallback() && state.getMode() == FetchMode.PRIMARY && !state.isFallbackUsed();
    }

    private void switchToFallback(PaginationRequest request, CrawlRunState state, CrawlObserver observer, String reason) {
        Instant anchor = state.oldestTimestamp();
        if (anchor == null) {
            anchor = clock.instant();
        }
        UpstreamRequest fallback = request.getFallbackFactory().apply(anchor);
        log.info("[{}] Switching to fallback at {} items, anchored on {}: {}",
                request.getRunId(), state.itemCount(), anchor, reason);
        state.switchToFallback(fallback);
        observer.onModeSwitched(request.getRunId(), FetchMode.PRIMARY, FetchMode.FALLBACK, reason);
    }

    private void advanceChunk(PaginationRequest request, CrawlRunState state, CrawlObserver observer) {
        int nextIndex = state.getChunkIndex() + 1;
        if (nextIndex >= request.getChunks().size()) {
            state.setState(EngineState.DONE_EXHAUSTED);
            return;
        }
        Chunk chunk = request.getChunks().get(nextIndex);
        state.setChunkIndex(nextIndex);
        state.resetSlots();
        state.resetProgressCounters();
        state.resetAttemptedToCurrent();
        state.returnToPrimary(request.getChunkRequestFactory().apply(chunk));
        observer.onChunkStarted(request.getRunId(), chunk, nextIndex + 1, request.getChunks().size());
    }

    // ================================================================= helpers

    private void pause(long base, long jitter, CrawlControl control) {
        sleeper.sleepWithJitter(base, jitter, control::shouldStop);
    }

    private void saveCheckpoint(PaginationRequest request, CrawlRunState state) {
        Integer chunkIndex = request.isChunked() ? Integer.valueOf(state.getChunkIndex()) : request.getChunkIndex();
        checkpointSink.saveCheckpoint(request.getRunId(), new Checkpoint(
                state.activeCursor(),
                state.getMode(),
                state.itemCount(),
                state.getLastItemId(),
                state.currentSessionId(),
                chunkIndex,
                clock.instant()));
    }

    private PaginationOutcome finish(PaginationRequest request, CrawlRunState state, CrawlObserver observer) {
        EngineState terminal = state.getState();
        String error = terminal == EngineState.DONE_FAILED ? state.getLastError() : null;
        observer.onRunTerminal(request.getRunId(), terminal, state.itemCount(), error);
        return PaginationOutcome.builder()
                .state(terminal)
                .items(state.itemList())
                .error(error)
                .errorKind(terminal == EngineState.DONE_FAILED ? state.getLastErrorKind()
                        : terminal == EngineState.DONE_CANCELLED ? ErrorKind.CANCELLED : null)
                .attemptedSessionIds(new LinkedHashSet<>(state.getAttemptedSessionIds()))
                .lastSessionId(state.currentSessionId())
                .finalCursor(state.activeCursor())
                .fallbackUsed(state.isFallbackUsed())
                .stopReached(state.isStopReached())
                .build();
    }
}
