package com.mouse.crawl.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.model.CrawlItem;
import com.mouse.crawl.model.PageResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimelineItemExtractorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TimelineItemExtractor extractor = new TimelineItemExtractor();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void extractPage_userTimeline_readsItemsAndBottomCursor() throws Exception {
        JsonNode payload = json("""
            {"data":{"user":{"result":{"timeline":{"timeline":{"instructions":[
              {"type":"TimelineClearCache"},
              {"type":"TimelinePinEntry","entry":{"entryId":"tweet-1","content":{"itemContent":{"tweet_results":{"result":
                {"__typename":"Tweet","rest_id":"1","legacy":{"full_text":"pinned","created_at":"Sat Jun 01 10:00:00 +0000 2024"},
                 "core":{"user_results":{"result":{"legacy":{"screen_name":"alice"}}}}}}}}}},
              {"type":"TimelineAddEntries","entries":[
                {"entryId":"tweet-2","content":{"itemContent":{"tweet_results":{"result":
                  {"__typename":"TweetWithVisibilityResults","tweet":{"rest_id":"2",
                   "legacy":{"full_text":"short","created_at":"Fri May 31 09:30:00 +0000 2024"},
                   "note_tweet":{"note_tweet_results":{"result":{"text":"the long version"}}},
                   "core":{"user_results":{"result":{"core":{"screen_name":"bob"}}}}}}}}}},
                {"entryId":"cursor-top-1","content":{"value":"TOP","cursorType":"Top"}},
                {"entryId":"cursor-bottom-1","content":{"value":"NEXT","cursorType":"Bottom"}}
              ]}
            ]}}}}}}
            """);

        PageResult page = extractor.extractPage(payload);

        assertThat(page.nextCursor()).isEqualTo("NEXT");
        assertThat(page.items()).extracting(CrawlItem::getId).containsExactly("1", "2");
        CrawlItem first = page.items().get(0);
        assertThat(first.getAuthorHandle()).isEqualTo("alice");
        assertThat(first.getCreatedAt()).isEqualTo(Instant.parse("2024-06-01T10:00:00Z"));
        CrawlItem second = page.items().get(1);
        assertThat(second.getText()).isEqualTo("the long version");
        assertThat(second.getAuthorHandle()).isEqualTo("bob");
        assertThat(second.getRaw().path("rest_id").asText()).isEqualTo("2");
    }

    @Test
    void extractPage_searchModulesAndReplacedCursor() throws Exception {
        JsonNode payload = json("""
            {"data":{"search_by_raw_query":{"search_timeline":{"timeline":{"instructions":[
              {"type":"TimelineAddEntries","entries":[
                {"entryId":"conversation-9","content":{"items":[
                  {"item":{"itemContent":{"tweet_results":{"result":{"rest_id":"9","legacy":{"full_text":"a"}}}}}},
                  {"item":{"itemContent":{"tweet_results":{"result":{"rest_id":"10","legacy":{"full_text":"b"}}}}}}
                ]}}
              ]},
              {"type":"TimelineReplaceEntry","entry":{"entryId":"cursor-bottom-0","content":{"value":"REPLACED"}}}
            ]}}}}}
            """);

        PageResult page = extractor.extractPage(payload);

        assertThat(page.items()).extracting(CrawlItem::getId).containsExactly("9", "10");
        assertThat(page.nextCursor()).isEqualTo("REPLACED");
    }

    @Test
    void extractPage_noCursor_returnsNullCursor() throws Exception {
        JsonNode payload = json("""
            {"data":{"timeline":{"instructions":[{"type":"TimelineAddEntries","entries":[]}]}}}
            """);

        PageResult page = extractor.extractPage(payload);

        assertThat(page.isEmpty()).isTrue();
        assertThat(page.nextCursor()).isNull();
    }

    @Test
    void extractPage_tombstonesAndBadDates_areTolerated() throws Exception {
        JsonNode payload = json("""
            {"data":{"timeline":{"instructions":[{"type":"TimelineAddEntries","entries":[
              {"entryId":"tweet-x","content":{"itemContent":{"tweet_results":{"result":{"__typename":"TweetTombstone"}}}}},
              {"entryId":"tweet-3","content":{"itemContent":{"tweet_results":{"result":
                {"rest_id":"3","legacy":{"created_at":"yesterday"}}}}}}
            ]}]}}}
            """);

        PageResult page = extractor.extractPage(payload);

        assertThat(page.items()).singleElement().satisfies(item -> {
            assertThat(item.getId()).isEqualTo("3");
            assertThat(item.getCreatedAt()).isNull();
        });
    }

    @Test
    void extractPage_missingInstructions_isDataExtractionError() throws Exception {
        assertThatThrownBy(() -> extractor.extractPage(json("{\"data\":{\"user\":{}}}")))
                .isInstanceOf(CrawlException.class)
                .extracting(e -> ((CrawlException) e).getKind())
                .isEqualTo(ErrorKind.DATA_EXTRACTION);
    }

    @Test
    void extractPage_upstreamErrors_areClassified() throws Exception {
        assertThatThrownBy(() -> extractor.extractPage(json("{\"errors\":[{\"message\":\"Rate limit exceeded\"}]}")))
                .extracting(e -> ((CrawlException) e).getKind())
                .isEqualTo(ErrorKind.RATE_LIMIT);
        assertThatThrownBy(() -> extractor.extractPage(json("{\"errors\":[{\"message\":\"Could not authenticate you\"}]}")))
                .extracting(e -> ((CrawlException) e).getKind())
                .isEqualTo(ErrorKind.AUTH);
        assertThatThrownBy(() -> extractor.extractPage(json("{\"errors\":[{\"message\":\"Query: Unspecified\"}]}")))
                .extracting(e -> ((CrawlException) e).getKind())
                .isEqualTo(ErrorKind.DATA_EXTRACTION);
    }

    @Test
    void extractPage_partialErrorsWithData_areIgnored() throws Exception {
        JsonNode payload = json("""
            {"errors":[{"message":"Rate limit exceeded"}],
             "data":{"timeline":{"instructions":[{"type":"TimelineAddEntries","entries":[]}]}}}
            """);

        assertThat(extractor.extractPage(payload).isEmpty()).isTrue();
    }

    @Test
    void extractUserId_readsRestId() throws Exception {
        assertThat(extractor.extractUserId(json("{\"data\":{\"user\":{\"result\":{\"__typename\":\"User\",\"rest_id\":\"44196397\"}}}}")))
                .contains("44196397");
        assertThat(extractor.extractUserId(json("{\"data\":{\"user\":{\"result\":{\"__typename\":\"UserUnavailable\",\"rest_id\":\"1\"}}}}")))
                .isEmpty();
        assertThat(extractor.extractUserId(json("{\"data\":{}}"))).isEmpty();
    }
}
