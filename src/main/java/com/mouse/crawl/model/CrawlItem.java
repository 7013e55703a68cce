package com.mouse.crawl.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CrawlItem {
    String id;
    Instant createdAt;
    String authorHandle;
    String text;
    JsonNode raw;
}
