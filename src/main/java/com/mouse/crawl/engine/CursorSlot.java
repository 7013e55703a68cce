package com.mouse.crawl.engine;

import com.mouse.crawl.enums.FetchMode;

/**
 * Pagination position of one fetch mode. Each mode owns its slot so switching never mixes cursors.
 */
public record CursorSlot(FetchMode mode, String cursor) {

    public static CursorSlot start(FetchMode mode) {
        return new CursorSlot(mode, null);
    }

    public CursorSlot advance(String next) {
        return new CursorSlot(mode, next);
    }

    /** Key used to count how many sessions saw this exact position empty. */
    String positionKey() {
        return mode + "|" + (cursor == null ? "<start>" : cursor);
    }
}
