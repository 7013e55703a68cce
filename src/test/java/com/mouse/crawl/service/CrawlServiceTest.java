package com.mouse.crawl.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.mouse.crawl.config.ChunkPolicy;
import com.mouse.crawl.credential.CredentialSource;
import com.mouse.crawl.dispatch.OperationRequestFactory;
import com.mouse.crawl.dispatch.RequestDispatcher;
import com.mouse.crawl.dispatch.UpstreamRequest;
import com.mouse.crawl.engine.ChunkOrchestrator;
import com.mouse.crawl.engine.CrawlControl;
import com.mouse.crawl.engine.CrawlObserver;
import com.mouse.crawl.engine.PaginationEngine;
import com.mouse.crawl.engine.PaginationOutcome;
import com.mouse.crawl.engine.PaginationRequest;
import com.mouse.crawl.enums.EngineState;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.enums.OperationKind;
import com.mouse.crawl.enums.TargetType;
import com.mouse.crawl.exception.CrawlConfigurationException;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.extract.ItemExtractor;
import com.mouse.crawl.manager.SessionPool;
import com.mouse.crawl.model.Chunk;
import com.mouse.crawl.model.CrawlRequest;
import com.mouse.crawl.model.CrawlResult;
import com.mouse.crawl.model.DateRange;
import com.mouse.crawl.model.Session;
import com.mouse.crawl.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlServiceTest {

    @Mock
    private PaginationEngine engine;

    @Mock
    private ChunkOrchestrator chunkOrchestrator;

    @Mock
    private RequestDispatcher dispatcher;

    @Mock
    private ItemExtractor extractor;

    @Mock
    private CredentialSource credentialSource;

    @Mock
    private CrawlObserver observer;

    private SessionPool sessionPool;
    private CrawlService service;

    @BeforeEach
    void setUp() {
        sessionPool = new SessionPool(Fixtures.config(), credentialSource);
        sessionPool.register(Fixtures.session("s1"));
        sessionPool.register(Fixtures.session("s2"));
        service = new CrawlService(engine, chunkOrchestrator, dispatcher, extractor, sessionPool,
                new OperationRequestFactory(Fixtures.config()), ChunkPolicy.defaults(), observer);
    }

    private static CrawlRequest.CrawlRequestBuilder request(TargetType type, String target) {
        return CrawlRequest.builder().runId("run-1").targetType(type).target(target).limit(100);
    }

    private static PaginationOutcome exhausted() {
        return PaginationOutcome.builder().state(EngineState.DONE_EXHAUSTED)
                .items(List.of(Fixtures.item("1", Instant.parse("2024-06-01T00:00:00Z")))).build();
    }

    private static Session withId(String id) {
        return argThat(session -> session != null && id.equals(session.getId()));
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("rejects incomplete requests before any network call")
        void rejectsInvalid() {
            assertThatThrownBy(() -> service.crawl(request(TargetType.SEARCH, " ").build()))
                    .isInstanceOf(CrawlConfigurationException.class);
            assertThatThrownBy(() -> service.crawl(request(TargetType.SEARCH, "q").limit(0).build()))
                    .isInstanceOf(CrawlConfigurationException.class);
            assertThatThrownBy(() -> service.crawl(request(null, "q").build()))
                    .isInstanceOf(CrawlConfigurationException.class);
            assertThatThrownBy(() -> service.crawl(request(TargetType.HISTORICAL_SEARCH, "q").build()))
                    .isInstanceOf(CrawlConfigurationException.class);
            assertThatThrownBy(() -> service.crawl(request(TargetType.SEARCH, "q")
                    .dateRange(new DateRange(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 1, 1))).build()))
                    .isInstanceOf(CrawlConfigurationException.class);

            verifyNoInteractions(dispatcher, engine, chunkOrchestrator);
        }

        @Test
        @DisplayName("assigns a run id and strips the @ from screen names")
        void normalises() {
            CrawlRequest validated = service.validate(request(TargetType.USER_FEED, " @alice ").runId(null).build());

            assertThat(validated.getRunId()).isNotBlank();
            assertThat(validated.getTarget()).isEqualTo("alice");
        }
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("a search runs the engine once without a fallback")
        void search() {
            when(engine.run(any(), any(), any())).thenReturn(exhausted());

            CrawlResult result = service.crawl(request(TargetType.SEARCH, "bitcoin lang:en").build());

            ArgumentCaptor<PaginationRequest> sent = ArgumentCaptor.forClass(PaginationRequest.class);
            verify(engine).run(sent.capture(), any(), eq(observer));
            assertThat(sent.getValue().getRequest().operation()).isEqualTo(OperationKind.SEARCH_TIMELINE);
            assertThat(sent.getValue().getRequest().rawQuery()).isEqualTo("bitcoin lang:en");
            assertThat(sent.getValue().hasFallback()).isFalse();
            assertThat(sent.getValue().getLimit()).isEqualTo(100);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.itemCount()).isEqualTo(1);
            assertThat(result.getRunId()).isEqualTo("run-1");
        }

        @Test
        @DisplayName("historical searches go to the chunk orchestrator")
        void historical() {
            CrawlResult chunked = CrawlResult.builder().runId("run-1").success(true).state(EngineState.DONE_SUCCESS).build();
            when(chunkOrchestrator.run(any(), any(), any())).thenReturn(chunked);
            DateRange range = new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 1));

            assertThat(service.crawl(request(TargetType.HISTORICAL_SEARCH, "q").dateRange(range).build())).isSameAs(chunked);

            verify(chunkOrchestrator).run(any(), any(), any());
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("a dated search walks the monthly slices newest first inside one engine run")
        void datedSearch() {
            when(engine.run(any(), any(), any())).thenReturn(exhausted());
            DateRange range = new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 1));

            CrawlResult result = service.crawl(request(TargetType.SEARCH, "bitcoin").dateRange(range).build());

            ArgumentCaptor<PaginationRequest> sent = ArgumentCaptor.forClass(PaginationRequest.class);
            verify(engine).run(sent.capture(), any(), eq(observer));
            verifyNoInteractions(chunkOrchestrator);
            PaginationRequest pagination = sent.getValue();
            assertThat(pagination.isChunked()).isTrue();
            assertThat(pagination.getChunks()).extracting(Chunk::getSince)
                    .containsExactly(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1));
            assertThat(pagination.getChunkRequestFactory().apply(pagination.getChunks().get(0)).rawQuery())
                    .isEqualTo("bitcoin since:2024-02-01 until:2024-03-01");
            assertThat(result.isSuccess()).isTrue();
        }
    }

    @Nested
    @DisplayName("user feed")
    class UserFeed {

        @Test
        @DisplayName("resolves the user, pages the feed and wires the dated fallback")
        void resolvesAndPages() {
            when(dispatcher.dispatch(argThat(r -> r != null && r.operation() == OperationKind.USER_BY_SCREEN_NAME), withId("s1"),
                    anyBoolean(), any())).thenReturn(JsonNodeFactory.instance.objectNode());
            when(extractor.extractUserId(any())).thenReturn(Optional.of("42"));
            when(engine.run(any(), any(), any())).thenReturn(exhausted());

            CrawlResult result = service.crawl(request(TargetType.USER_FEED, "@alice").build(), CrawlControl.never(), observer);

            assertThat(result.isSuccess()).isTrue();
            ArgumentCaptor<PaginationRequest> sent = ArgumentCaptor.forClass(PaginationRequest.class);
            verify(engine).run(sent.capture(), any(), eq(observer));
            PaginationRequest pagination = sent.getValue();
            assertThat(pagination.getRequest().operation()).isEqualTo(OperationKind.USER_FEED);
            assertThat(pagination.getRequest().variables()).containsEntry("userId", "42");
            assertThat(pagination.hasFallback()).isTrue();

            UpstreamRequest fallback = pagination.getFallbackFactory().apply(Instant.parse("2024-05-10T23:30:00Z"));
            assertThat(fallback.operation()).isEqualTo(OperationKind.SEARCH_TIMELINE);
            assertThat(fallback.rawQuery()).isEqualTo("from:alice until:2024-05-11");
        }

        @Test
        @DisplayName("an unknown user fails without paging")
        void unknownUser() {
            when(dispatcher.dispatch(any(), any(), anyBoolean(), any())).thenReturn(JsonNodeFactory.instance.objectNode());
            when(extractor.extractUserId(any())).thenReturn(Optional.empty());

            CrawlResult result = service.crawl(request(TargetType.USER_FEED, "ghost").build());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getState()).isEqualTo(EngineState.DONE_FAILED);
            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.NOT_FOUND);
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("user lookup moves to another session after an auth failure")
        void lookupRotatesOnAuth() {
            when(dispatcher.dispatch(any(), withId("s1"), anyBoolean(), any()))
                    .thenThrow(new CrawlException(ErrorKind.AUTH, "401"));
            when(dispatcher.dispatch(any(), withId("s2"), anyBoolean(), any()))
                    .thenReturn(JsonNodeFactory.instance.objectNode());
            when(extractor.extractUserId(any())).thenReturn(Optional.of("42"));
            when(engine.run(any(), any(), any())).thenReturn(exhausted());

            CrawlResult result = service.crawl(request(TargetType.USER_FEED, "alice").build());

            assertThat(result.isSuccess()).isTrue();
            assertThat(sessionPool.getById("s1").orElseThrow().getErrorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("other lookup failures are surfaced without rotating")
        void lookupNetworkFailure() {
            when(dispatcher.dispatch(any(), any(), anyBoolean(), any()))
                    .thenThrow(new CrawlException(ErrorKind.NETWORK, "Connection reset"));

            CrawlResult result = service.crawl(request(TargetType.USER_FEED, "alice").build());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.NETWORK);
            verify(dispatcher, times(1)).dispatch(any(), any(), anyBoolean(), any());
            verify(engine, never()).run(any(), any(), any());
        }
    }

    @Test
    void fallbackUntil_coversTheAnchorDay() {
        assertThat(CrawlService.fallbackUntil(Instant.parse("2024-02-29T00:00:00Z"))).isEqualTo(LocalDate.of(2024, 3, 1));
    }
}
