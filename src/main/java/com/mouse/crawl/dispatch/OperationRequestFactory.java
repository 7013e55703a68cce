package com.mouse.crawl.dispatch;

import com.mouse.crawl.config.CrawlerConfig;
import com.mouse.crawl.enums.OperationKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variable sets for each upstream operation.
 */
@Component
@RequiredArgsConstructor
public class OperationRequestFactory {

    private final CrawlerConfig config;

    public UpstreamRequest userLookup(String screenName) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("screen_name", screenName);
        variables.put("withSafetyModeUserFields", true);
        return UpstreamRequest.of(OperationKind.USER_BY_SCREEN_NAME, variables);
    }

    public UpstreamRequest userFeed(String userId) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("userId", userId);
        variables.put("count", config.getPageSize());
        variables.put("includePromotedContent", false);
        variables.put("withQuickPromoteEligibilityTweetFields", false);
        variables.put("withVoice", true);
        return UpstreamRequest.of(OperationKind.USER_FEED, variables);
    }

    public UpstreamRequest search(String rawQuery) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("rawQuery", rawQuery);
        variables.put("count", config.getPageSize());
        variables.put("querySource", "typed_query");
        variables.put("product", "Latest");
        return UpstreamRequest.of(OperationKind.SEARCH_TIMELINE, variables);
    }

    public UpstreamRequest itemDetail(String itemId) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("focalTweetId", itemId);
        variables.put("includePromotedContent", false);
        variables.put("withVoice", true);
        variables.put("referrer", "tweet");
        return UpstreamRequest.of(OperationKind.ITEM_DETAIL, variables);
    }
}
