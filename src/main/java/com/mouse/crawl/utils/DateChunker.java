package com.mouse.crawl.utils;

import com.mouse.crawl.model.Chunk;
import com.mouse.crawl.model.DateRange;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a half-open date range on calendar-month boundaries.
 */
public final class DateChunker {

    private static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("yyyy-MM");

    private DateChunker() {
    }

    /**
     * Contiguous month chunks covering [start, end) exactly, oldest first.
     * The first and last chunk are clipped to the range.
     */
    public static List<Chunk> monthly(LocalDate start, LocalDate end) {
        List<Chunk> chunks = new ArrayList<>();
        LocalDate since = start;
        int index = 0;
        while (since.isBefore(end)) {
            LocalDate nextMonth = since.withDayOfMonth(1).plusMonths(1);
            LocalDate until = nextMonth.isBefore(end) ? nextMonth : end;
            chunks.add(new Chunk(index++, since, until, since.format(LABEL)));
            since = until;
        }
        return chunks;
    }

    public static List<Chunk> monthly(DateRange range, boolean newestFirst) {
        List<Chunk> chunks = monthly(range.start(), range.end());
        if (newestFirst) {
            Collections.reverse(chunks);
        }
        return chunks;
    }
}
