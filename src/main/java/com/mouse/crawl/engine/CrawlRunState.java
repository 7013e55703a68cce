package com.mouse.crawl.engine;

import com.mouse.crawl.dispatch.UpstreamRequest;
import com.mouse.crawl.enums.EngineState;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.enums.FetchMode;
import com.mouse.crawl.model.CrawlItem;
import com.mouse.crawl.model.Session;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable state of one pagination run. Owned by a single engine invocation, never shared.
 */
@Getter
public class CrawlRunState {

    private final String runId;
    private final int limit;
    private final String stopAtItemId;
    private final Instant stopBeforeTimestamp;
    private final Set<String> knownItemIds;

    private final Map<String, CrawlItem> items = new LinkedHashMap<>();
    private final Map<FetchMode, CursorSlot> slots = new EnumMap<>(FetchMode.class);
    private final Set<String> attemptedSessionIds = new LinkedHashSet<>();
    private final Map<String, Set<String>> emptySessionsByPosition = new HashMap<>();

    @Setter
    private EngineState state = EngineState.FETCH_PRIMARY;
    private FetchMode mode = FetchMode.PRIMARY;
    @Setter
    private UpstreamRequest currentRequest;
    private Session currentSession;

    private int consecutiveEmpty;
    private int consecutiveErrors;
    private int stalledPages;
    private boolean stopReached;
    private boolean fallbackUsed;
    @Setter
    private int chunkIndex;

    @Setter
    private String pendingRotationReason;
    private String lastError;
    private ErrorKind lastErrorKind;
    private String lastItemId;
    private int replayedOnLastPage;
    private int replayPages;

    public CrawlRunState(String runId, int limit, String stopAtItemId, Instant stopBeforeTimestamp,
                         Set<String> knownItemIds) {
        this.runId = runId;
        this.limit = limit;
        this.stopAtItemId = stopAtItemId;
        this.stopBeforeTimestamp = stopBeforeTimestamp;
        this.knownItemIds = knownItemIds == null ? Set.of() : Set.copyOf(knownItemIds);
        resetSlots();
    }

    // ---------------------------------------------------------------- items

    /**
     * Appends unseen items in page order until the limit or a stop condition.
     * The item that triggers a stop condition is not kept. Known ids are skipped without counting
     * toward the limit; how many were skipped is left in {@link #getReplayedOnLastPage()}.
     *
     * @return number of items actually added
     */
    public int accumulate(List<CrawlItem> page) {
        int added = 0;
        replayedOnLastPage = 0;
        for (CrawlItem item : page) {
            if (items.size() >= limit) {
                break;
            }
            if (stopAtItemId != null && stopAtItemId.equals(item.getId())) {
                stopReached = true;
                break;
            }
            if (stopBeforeTimestamp != null && item.getCreatedAt() != null
                    && item.getCreatedAt().isBefore(stopBeforeTimestamp)) {
                stopReached = true;
                break;
            }
            if (knownItemIds.contains(item.getId())) {
                replayedOnLastPage++;
                continue;
            }
            if (items.putIfAbsent(item.getId(), item) == null) {
                lastItemId = item.getId();
                added++;
            }
        }
        return added;
    }

    public int itemCount() {
        return items.size();
    }

    public boolean limitReached() {
        return items.size() >= limit;
    }

    public List<CrawlItem> itemList() {
        return Collections.unmodifiableList(new ArrayList<>(items.values()));
    }

    /** Oldest creation time among collected items, or null if none carry one. */
    public Instant oldestTimestamp() {
        return items.values().stream()
                .map(CrawlItem::getCreatedAt)
                .filter(Objects::nonNull)
                .min(Instant::compareTo)
                .orElse(null);
    }

    // ---------------------------------------------------------------- cursors

    public CursorSlot currentSlot() {
        return slots.get(mode);
    }

    public String activeCursor() {
        return currentSlot().cursor();
    }

    /** Moves only the current mode's cursor. */
    public void advanceCursor(String next) {
        slots.put(mode, currentSlot().advance(next));
    }

    public final void resetSlots() {
        for (FetchMode m : FetchMode.values()) {
            slots.put(m, CursorSlot.start(m));
        }
    }

    public void switchToFallback(UpstreamRequest fallbackRequest) {
        mode = FetchMode.FALLBACK;
        fallbackUsed = true;
        slots.put(FetchMode.FALLBACK, CursorSlot.start(FetchMode.FALLBACK));
        currentRequest = fallbackRequest;
        state = EngineState.FETCH_FALLBACK;
        resetProgressCounters();
        resetAttemptedToCurrent();
    }

    public void returnToPrimary(UpstreamRequest primaryRequest) {
        mode = FetchMode.PRIMARY;
        currentRequest = primaryRequest;
        state = EngineState.FETCH_PRIMARY;
    }

    // ---------------------------------------------------------------- sessions

    public void useSession(Session session) {
        currentSession = session;
        attemptedSessionIds.add(session.getId());
    }

    public String currentSessionId() {
        return currentSession == null ? null : currentSession.getId();
    }

    public void resetAttemptedToCurrent() {
        attemptedSessionIds.clear();
        if (currentSession != null) {
            attemptedSessionIds.add(currentSession.getId());
        }
    }

    // ---------------------------------------------------------------- counters

    /**
     * Records that the current session saw the current position empty.
     *
     * @return distinct sessions that have now seen this position empty
     */
    public int recordEmptyAtCurrentPosition() {
        consecutiveEmpty++;
        Set<String> sessions = emptySessionsByPosition.computeIfAbsent(currentSlot().positionKey(), k -> new LinkedHashSet<>());
        if (currentSession != null) {
            sessions.add(currentSession.getId());
        }
        return sessions.size();
    }

    public void recordProgress() {
        consecutiveEmpty = 0;
        stalledPages = 0;
        replayPages = 0;
    }

    /**
     * A page made only of known items with a moving cursor. Each such page holds at least one known id,
     * so more of them in a row than there are known ids means the upstream is looping.
     *
     * @return false once that bound is exceeded
     */
    public boolean recordReplayPage() {
        if (++replayPages > knownItemIds.size()) {
            return false;
        }
        consecutiveEmpty = 0;
        stalledPages = 0;
        return true;
    }

    public int recordStalledPage() {
        return ++stalledPages;
    }

    public int recordError(String message, ErrorKind kind) {
        lastError = message;
        lastErrorKind = kind;
        return ++consecutiveErrors;
    }

    public void resetErrors() {
        consecutiveErrors = 0;
    }

    public void resetProgressCounters() {
        consecutiveEmpty = 0;
        consecutiveErrors = 0;
        stalledPages = 0;
        emptySessionsByPosition.clear();
    }

    public void fail(String message, ErrorKind kind) {
        lastError = message;
        lastErrorKind = kind;
        state = EngineState.DONE_FAILED;
    }
}
