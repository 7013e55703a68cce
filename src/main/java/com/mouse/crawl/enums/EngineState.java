package com.mouse.crawl.enums;

public enum EngineState {

    FETCH_PRIMARY,

    FETCH_FALLBACK,

    ROTATE_SESSION,

    ADVANCE_CHUNK,

    /**
     * Target item count or a caller stop condition was reached
     */
    DONE_SUCCESS,

    /**
     * Pagination confirmed empty before the target was reached
     */
    DONE_EXHAUSTED,

    /**
     * Unrecoverable error; partial items are still returned
     */
    DONE_FAILED,

    DONE_CANCELLED;

    public boolean isTerminal() {
        return name().startsWith("DONE_");
    }

    public static EngineState fetching(FetchMode mode) {
        return mode == FetchMode.FALLBACK ? FETCH_FALLBACK : FETCH_PRIMARY;
    }
}
