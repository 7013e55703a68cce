package com.mouse.crawl.model;

import lombok.Getter;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One calendar-month slice [since, until) of a historical crawl.
 * Only the retry bookkeeping changes after creation.
 */
@Getter
public class Chunk {

    private final int index;
    private final LocalDate since;
    private final LocalDate until;
    private final String label;

    private int retryCount;
    private String lastError;
    private final Set<String> failedSessionIds = new LinkedHashSet<>();

    public Chunk(int index, LocalDate since, LocalDate until, String label) {
        this.index = index;
        this.since = since;
        this.until = until;
        this.label = label;
    }

    public void recordFailure(String error, Set<String> sessionIds) {
        this.retryCount++;
        this.lastError = error;
        if (sessionIds != null) {
            failedSessionIds.addAll(sessionIds);
        }
    }

    public Set<String> getFailedSessionIds() {
        return Collections.unmodifiableSet(failedSessionIds);
    }

    @Override
    public String toString() {
        return label + " [" + since + ", " + until + ")";
    }
}
