package com.mouse.crawl.enums;

public enum TargetType {

    /**
     * A user's own feed, paged through the user-feed operation
     */
    USER_FEED,

    /**
     * A free-text search query
     */
    SEARCH,

    /**
     * A search query bounded by a date range, split into monthly chunks
     */
    HISTORICAL_SEARCH
}
