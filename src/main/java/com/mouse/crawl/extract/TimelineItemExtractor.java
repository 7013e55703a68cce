package com.mouse.crawl.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.model.CrawlItem;
import com.mouse.crawl.model.PageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads timeline instructions (user feed and search share the shape).
 */
@Slf4j
@Component
public class TimelineItemExtractor implements ItemExtractor {

    private static final DateTimeFormatter CREATED_AT =
            DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH);

    @Override
    public PageResult extractPage(JsonNode payload) {
        failOnUpstreamErrors(payload);

        JsonNode instructions = payload == null ? null : payload.findValue("instructions");
        if (instructions == null || !instructions.isArray()) {
            throw new CrawlException(ErrorKind.DATA_EXTRACTION, "Payload has no timeline instructions");
        }

        List<CrawlItem> items = new ArrayList<>();
        String bottomCursor = null;
        for (JsonNode instruction : instructions) {
            String type = instruction.path("type").asText();
            List<JsonNode> entries = new ArrayList<>();
            if ("TimelineAddEntries".equals(type)) {
                instruction.path("entries").forEach(entries::add);
            } else if ("TimelineReplaceEntry".equals(type) || "TimelinePinEntry".equals(type)) {
                entries.add(instruction.path("entry"));
            }

            for (JsonNode entry : entries) {
                String cursor = bottomCursorOf(entry);
                if (cursor != null) {
                    bottomCursor = cursor;
                    continue;
                }
                collectItems(entry.path("content"), items);
            }
        }
        return new PageResult(items, bottomCursor);
    }

    @Override
    public Optional<String> extractUserId(JsonNode payload) {
        failOnUpstreamErrors(payload);
        JsonNode result = payload.path("data").path("user").path("result");
        if ("UserUnavailable".equals(result.path("__typename").asText())) {
            return Optional.empty();
        }
        String restId = result.path("rest_id").asText(null);
        return Optional.ofNullable(restId).filter(id -> !id.isBlank());
    }

    private static String bottomCursorOf(JsonNode entry) {
        String entryId = entry.path("entryId").asText("");
        JsonNode content = entry.path("content");
        boolean bottom = entryId.startsWith("cursor-bottom-")
                || "Bottom".equals(content.path("cursorType").asText());
        if (!bottom) {
            return null;
        }
        String value = content.path("value").asText(null);
        return value == null || value.isBlank() ? null : value;
    }

    private void collectItems(JsonNode content, List<CrawlItem> sink) {
        JsonNode single = content.path("itemContent").path("tweet_results").path("result");
        if (!single.isMissingNode()) {
            toItem(single).ifPresent(sink::add);
        }
        for (JsonNode moduleItem : content.path("items")) {
            JsonNode nested = moduleItem.path("item").path("itemContent").path("tweet_results").path("result");
            if (!nested.isMissingNode()) {
                toItem(nested).ifPresent(sink::add);
            }
        }
    }

    Optional<CrawlItem> toItem(JsonNode result) {
        JsonNode tweet = "TweetWithVisibilityResults".equals(result.path("__typename").asText())
                ? result.path("tweet")
                : result;
        String id = tweet.path("rest_id").asText(null);
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }

        JsonNode legacy = tweet.path("legacy");
        String text = tweet.path("note_tweet").path("note_tweet_results").path("result").path("text").asText(null);
        if (text == null) {
            text = legacy.path("full_text").asText(null);
        }

        JsonNode user = tweet.path("core").path("user_results").path("result");
        String handle = user.path("legacy").path("screen_name").asText(null);
        if (handle == null) {
            handle = user.path("core").path("screen_name").asText(null);
        }

        return Optional.of(CrawlItem.builder()
                .id(id)
                .createdAt(parseCreatedAt(legacy.path("created_at").asText(null), id))
                .authorHandle(handle)
                .text(text)
                .raw(tweet)
                .build());
    }

    private static Instant parseCreatedAt(String value, String id) {
        if (value == null) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value, CREATED_AT).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable created_at '{}' on item {}", value, id);
            return null;
        }
    }

    private static void failOnUpstreamErrors(JsonNode payload) {
        if (payload == null || payload.isMissingNode() || payload.isNull()) {
            throw new CrawlException(ErrorKind.DATA_EXTRACTION, "Empty payload");
        }
        JsonNode errors = payload.path("errors");
        if (!errors.isArray() || errors.isEmpty() || payload.path("data").isObject() && !payload.path("data").isEmpty()) {
            return;
        }
        String message = errors.get(0).path("message").asText("upstream error");
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("rate limit")) {
            throw new CrawlException(ErrorKind.RATE_LIMIT, message);
        }
        if (lower.contains("authenticate") || lower.contains("authorization") || lower.contains("unauthorized")) {
            throw new CrawlException(ErrorKind.AUTH, message);
        }
        throw new CrawlException(ErrorKind.DATA_EXTRACTION, "Upstream error: " + message);
    }
}
