package com.mouse.crawl.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.mouse.crawl.model.PageResult;

import java.util.Optional;

/**
 * Pure parsing of upstream payloads. No side effects.
 */
public interface ItemExtractor {

    /**
     * @throws com.mouse.crawl.exception.CrawlException when the payload is an upstream error
     *         or no longer has a recognisable timeline shape
     */
    PageResult extractPage(JsonNode payload);

    /** Upstream id of a user lookup result; empty when the user does not exist. */
    Optional<String> extractUserId(JsonNode payload);
}
