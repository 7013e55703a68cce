package com.mouse.crawl.utils;

import com.mouse.crawl.model.Chunk;

import java.time.LocalDate;
import java.util.regex.Pattern;

public final class QueryComposer {

    private static final Pattern DATE_FILTER = Pattern.compile("\\s*\\b(since|until):\\S+", Pattern.CASE_INSENSITIVE);

    private QueryComposer() {
    }

    /** Removes any since:/until: operators already present in a user query. */
    public static String stripDateFilters(String query) {
        if (query == null) {
            return "";
        }
        return DATE_FILTER.matcher(query).replaceAll("").trim();
    }

    public static String forChunk(String baseQuery, Chunk chunk) {
        return stripDateFilters(baseQuery) + " since:" + chunk.getSince() + " until:" + chunk.getUntil();
    }

    /** Narrower query used once the user feed hits its depth limit. */
    public static String userFallback(String screenName, LocalDate until) {
        return "from:" + screenName + " until:" + until;
    }
}
