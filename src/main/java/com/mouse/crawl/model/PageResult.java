package com.mouse.crawl.model;

import java.util.List;

/**
 * One upstream page after extraction. nextCursor is null when the upstream returned none.
 */
public record PageResult(List<CrawlItem> items, String nextCursor) {

    public PageResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static PageResult empty(String cursor) {
        return new PageResult(List.of(), cursor);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
