package com.mouse.crawl.capture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.support.MutableClock;
import com.mouse.crawl.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractPassiveCaptureClientTest {

    /** Scripted page: each navigation or scroll releases the next queued payload. */
    static class ScriptedCaptureClient extends AbstractPassiveCaptureClient {

        final Deque<JsonNode> responses = new ArrayDeque<>();
        final List<String> actions = new ArrayList<>();
        CrawlException nextFailure;

        ScriptedCaptureClient(RecordingSleeper sleeper, MutableClock clock) {
            super("SearchTimeline", 3_000, 500, sleeper, clock);
        }

        @Override
        protected void start() {
            actions.add("start");
        }

        @Override
        protected void navigateToQuery(String query) {
            actions.add("navigate:" + query);
            release();
        }

        @Override
        protected void triggerLoadMore() {
            actions.add("scroll");
            release();
        }

        @Override
        protected void shutdown() {
            actions.add("shutdown");
        }

        private void release() {
            if (nextFailure != null) {
                onCaptureFailed(nextFailure);
                nextFailure = null;
            } else if (!responses.isEmpty()) {
                onCaptured(responses.poll());
            }
        }
    }

    private final ObjectMapper mapper = new ObjectMapper();
    private RecordingSleeper sleeper;
    private ScriptedCaptureClient client;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
        sleeper = new RecordingSleeper(clock);
        client = new ScriptedCaptureClient(sleeper, clock);
    }

    private JsonNode page(int n) {
        return mapper.createObjectNode().put("page", n);
    }

    @Test
    @DisplayName("starts the browser lazily and returns the captured payload")
    void startNewQuery() {
        client.responses.add(page(1));

        assertThat(client.startNewQuery("bitcoin", () -> false).get("page").asInt()).isEqualTo(1);
        assertThat(client.currentQuery()).isEqualTo("bitcoin");
        assertThat(client.actions).containsExactly("start", "navigate:bitcoin");
    }

    @Test
    @DisplayName("repeating the open query continues it instead of navigating again")
    void repeatedQueryContinues() {
        client.responses.add(page(1));
        client.responses.add(page(2));

        client.startNewQuery("bitcoin", () -> false);
        JsonNode second = client.startNewQuery("bitcoin", () -> false);

        assertThat(second.get("page").asInt()).isEqualTo(2);
        assertThat(client.actions).containsExactly("start", "navigate:bitcoin", "scroll");
    }

    @Test
    @DisplayName("times out when nothing is captured")
    void timesOut() {
        assertThatThrownBy(() -> client.startNewQuery("bitcoin", () -> false))
                .isInstanceOf(CrawlException.class)
                .satisfies(e -> {
                    assertThat(((CrawlException) e).getKind()).isEqualTo(ErrorKind.TIMEOUT);
                    assertThat(((CrawlException) e).isRetryable()).isTrue();
                });
        assertThat(sleeper.getSleeps()).containsOnly(500L).hasSize(6);
    }

    @Test
    @DisplayName("stops waiting when cancelled")
    void cancelled() {
        assertThatThrownBy(() -> client.startNewQuery("bitcoin", () -> true))
                .extracting(e -> ((CrawlException) e).getKind())
                .isEqualTo(ErrorKind.CANCELLED);
    }

    @Test
    @DisplayName("surfaces a failure reported by the page listener")
    void captureFailure() {
        client.nextFailure = new CrawlException(ErrorKind.RATE_LIMIT, "429 on SearchTimeline");

        assertThatThrownBy(() -> client.startNewQuery("bitcoin", () -> false))
                .extracting(e -> ((CrawlException) e).getKind())
                .isEqualTo(ErrorKind.RATE_LIMIT);
    }

    @Test
    @DisplayName("continue without an open query is rejected")
    void continueWithoutQuery() {
        assertThatThrownBy(() -> client.continueQuery(() -> false)).isInstanceOf(CrawlException.class);
    }

    @Test
    @DisplayName("restart shuts the browser down and forgets the query")
    void restart() {
        client.responses.add(page(1));
        client.responses.add(page(2));
        client.startNewQuery("bitcoin", () -> false);

        client.restart();

        assertThat(client.currentQuery()).isNull();
        client.startNewQuery("bitcoin", () -> false);
        assertThat(client.actions).containsExactly("start", "navigate:bitcoin", "shutdown", "start", "navigate:bitcoin");
    }
}
