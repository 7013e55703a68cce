package com.mouse.crawl.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Half-open range [start, end).
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
    }

    public boolean isEmpty() {
        return !start.isBefore(end);
    }
}
