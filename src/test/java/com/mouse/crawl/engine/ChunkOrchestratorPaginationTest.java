package com.mouse.crawl.engine;

import com.fasterxml.jackson.databind.node.POJONode;
import com.mouse.crawl.checkpoint.CheckpointSink;
import com.mouse.crawl.config.ChunkPolicy;
import com.mouse.crawl.config.PaginationPolicy;
import com.mouse.crawl.credential.CredentialSource;
import com.mouse.crawl.dispatch.OperationRequestFactory;
import com.mouse.crawl.dispatch.RequestDispatcher;
import com.mouse.crawl.dispatch.UpstreamRequest;
import com.mouse.crawl.enums.EngineState;
import com.mouse.crawl.enums.TargetType;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.extract.ItemExtractor;
import com.mouse.crawl.manager.SessionPool;
import com.mouse.crawl.model.CrawlItem;
import com.mouse.crawl.model.CrawlRequest;
import com.mouse.crawl.model.CrawlResult;
import com.mouse.crawl.model.DateRange;
import com.mouse.crawl.model.PageResult;
import com.mouse.crawl.model.Session;
import com.mouse.crawl.support.Fixtures;
import com.mouse.crawl.support.MutableClock;
import com.mouse.crawl.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.lenient;

/**
 * Historical searches driven through the real pagination loop against a scripted upstream.
 */
@ExtendWith(MockitoExtension.class)
class ChunkOrchestratorPaginationTest {

    private static final Instant BASE = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private RequestDispatcher dispatcher;

    @Mock
    private ItemExtractor extractor;

    @Mock
    private CheckpointSink checkpointSink;

    @Mock
    private CredentialSource credentialSource;

    @Mock
    private CrawlObserver observer;

    private SessionPool sessionPool;
    private ChunkOrchestrator orchestrator;

    /** Scripted upstream: "[session:]query@cursor" to a page or an error; anything else is an empty page. */
    private final Map<String, Object> script = new HashMap<>();
    private final List<String> calls = new ArrayList<>();

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(BASE);
        sessionPool = new SessionPool(Fixtures.config(), credentialSource);
        PaginationEngine engine = new PaginationEngine(dispatcher, extractor, sessionPool, checkpointSink,
                new RecordingSleeper(clock), PaginationPolicy.defaults(), clock);
        orchestrator = new ChunkOrchestrator(engine, sessionPool, new OperationRequestFactory(Fixtures.config()),
                ChunkPolicy.defaults());

        lenient().when(dispatcher.dispatch(any(), any(), anyBoolean(), any())).thenAnswer(inv -> {
            UpstreamRequest request = inv.getArgument(0);
            Session session = inv.getArgument(1);
            String key = request.rawQuery() + "@" + (request.cursor() == null ? "start" : request.cursor());
            calls.add(session.getId() + ":" + key);
            Object scripted = script.containsKey(session.getId() + ":" + key)
                    ? script.get(session.getId() + ":" + key)
                    : script.get(key);
            if (scripted instanceof RuntimeException) {
                throw (RuntimeException) scripted;
            }
            return new POJONode(scripted != null ? scripted : PageResult.empty(request.cursor()));
        });
        lenient().when(extractor.extractPage(any())).thenAnswer(inv -> ((POJONode) inv.getArgument(0)).getPojo());
    }

    private void sessions(String... ids) {
        for (String id : ids) {
            sessionPool.register(Fixtures.session(id));
        }
    }

    private static String month(int month) {
        LocalDate since = LocalDate.of(2024, month, 1);
        return "q since:" + since + " until:" + since.plusMonths(1);
    }

    private static PageResult page(String prefix, int from, int to, String next) {
        return new PageResult(IntStream.rangeClosed(from, to)
                .mapToObj(i -> Fixtures.item(prefix + i, BASE))
                .collect(Collectors.toList()), next);
    }

    private static CrawlRequest.CrawlRequestBuilder historical(LocalDate start, LocalDate end, int limit) {
        return CrawlRequest.builder()
                .runId("hist-1")
                .targetType(TargetType.HISTORICAL_SEARCH)
                .target("q")
                .limit(limit)
                .dateRange(new DateRange(start, end));
    }

    private static List<String> ids(CrawlResult result) {
        return result.getItems().stream().map(CrawlItem::getId).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("stop conditions")
    class StopConditions {

        @Test
        @DisplayName("reaching the stop item ends the whole run, older months are never requested")
        void stopItemEndsRun() {
            sessions("s1", "s2");
            script.put(month(3) + "@start", page("2024-03-", 1, 5, "c1"));
            script.put(month(2) + "@start", page("2024-02-", 1, 5, "c1"));
            script.put(month(1) + "@start", page("2024-01-", 1, 5, "c1"));

            CrawlResult result = orchestrator.run(
                    historical(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 4, 1), 100).stopAtItemId("2024-03-3").build(),
                    CrawlControl.never(), observer);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getState()).isEqualTo(EngineState.DONE_SUCCESS);
            assertThat(ids(result)).containsExactly("2024-03-1", "2024-03-2");
            assertThat(calls).noneMatch(c -> c.contains("since:2024-02") || c.contains("since:2024-01"));
            assertThat(result.getUnrecoveredChunks()).isEmpty();
        }

        @Test
        @DisplayName("an item older than the stop timestamp ends the whole run")
        void stopTimestampEndsRun() {
            sessions("s1");
            script.put(month(3) + "@start", new PageResult(List.of(
                    Fixtures.item("a", Instant.parse("2024-03-25T00:00:00Z")),
                    Fixtures.item("b", Instant.parse("2024-03-20T00:00:00Z")),
                    Fixtures.item("c", Instant.parse("2024-03-10T00:00:00Z"))), "c1"));
            script.put(month(2) + "@start", page("2024-02-", 1, 5, "c1"));

            CrawlResult result = orchestrator.run(
                    historical(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 4, 1), 100)
                            .stopBeforeTimestamp(Instant.parse("2024-03-15T00:00:00Z")).build(),
                    CrawlControl.never(), observer);

            assertThat(result.isSuccess()).isTrue();
            assertThat(ids(result)).containsExactly("a", "b");
            assertThat(calls).containsExactly("s1:" + month(3) + "@start");
        }
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("a retried chunk pages past what the failed attempt already delivered")
        void retryContinuesPastKnownItems() {
            sessions("s1", "s2");
            script.put(month(1) + "@start", page("m", 1, 6, "c1"));
            script.put("s1:" + month(1) + "@c1", CrawlException.fromStatus(401, "SearchTimeline"));
            script.put(month(1) + "@c1", page("m", 7, 12, "c2"));

            CrawlResult result = orchestrator.run(
                    historical(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1), 10).rotationEnabled(false).build(),
                    CrawlControl.never(), observer);

            assertThat(result.isSuccess()).isTrue();
            assertThat(ids(result)).containsExactly("m1", "m2", "m3", "m4", "m5", "m6", "m7", "m8", "m9", "m10");
            assertThat(calls).filteredOn(c -> c.startsWith("s2:"))
                    .containsExactly("s2:" + month(1) + "@start", "s2:" + month(1) + "@c1");
            assertThat(result.getUnrecoveredChunks()).isEmpty();
        }

        @Test
        @DisplayName("six months, the third fails on its first pass and its retry, then recovers on another session")
        void sixMonthRecovery() {
            sessions("s1", "s2", "s3");
            for (int m = 1; m <= 6; m++) {
                script.put(month(m) + "@start", page("2024-0" + m + "-", 1, 2, "c1"));
            }
            script.put("s1:" + month(4) + "@start", CrawlException.fromStatus(503, "SearchTimeline"));
            script.put("s2:" + month(4) + "@start", CrawlException.fromStatus(503, "SearchTimeline"));

            CrawlResult result = orchestrator.run(
                    historical(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 7, 1), 100)
                            .rotationEnabled(false)
                            .preferredSessionId("s1")
                            .build(),
                    CrawlControl.never(), observer);

            assertThat(result.getTotalChunks()).isEqualTo(6);
            assertThat(result.getUnrecoveredChunks()).isEmpty();
            assertThat(result.getRecoveredChunks()).isEqualTo(1);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getItems()).hasSize(12);

            List<String> aprilStarts = calls.stream()
                    .filter(c -> c.endsWith(month(4) + "@start"))
                    .distinct()
                    .map(c -> c.substring(0, c.indexOf(':')))
                    .collect(Collectors.toList());
            assertThat(aprilStarts).containsExactly("s1", "s2", "s3");
            assertThat(ids(result)).contains("2024-04-1", "2024-04-2");
        }
    }
}
