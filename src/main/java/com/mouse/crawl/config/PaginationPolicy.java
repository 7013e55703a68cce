package com.mouse.crawl.config;

import lombok.Builder;
import lombok.Value;

/**
 * Every heuristic threshold the pagination engine uses.
 * These are tuned against observed upstream behaviour, not a documented limit.
 */
@Value
@Builder(toBuilder = true)
public class PaginationPolicy {

    /** Empty pages on one session at one cursor before rotating to an untried session. */
    @Builder.Default
    int emptyRetriesBeforeRotation = 2;

    /** Distinct sessions that must see the same cursor empty before it counts as confirmed. */
    @Builder.Default
    int emptyConfirmationsAtCursor = 3;

    /** Consecutive empties needed to stop once emptiness is confirmed (or nobody is left to ask). */
    @Builder.Default
    int emptyAttemptsWhenConfirmed = 3;

    /** Hard cap on consecutive empties, confirmed or not. */
    @Builder.Default
    int maxConsecutiveEmpty = 5;

    /** Generic (non rotation-worthy) errors in a row before rotating anyway. */
    @Builder.Default
    int maxConsecutiveErrors = 3;

    /** Fallback trigger (a): zero items after this many distinct sessions were tried. */
    @Builder.Default
    int fallbackMinSessionsTried = 2;

    /** Fallback trigger (b): cursor stalled with items after more than this many were collected. */
    @Builder.Default
    int fallbackMinItemsCollected = 500;

    /** When every session is spent, switch to fallback instead of failing if at least this many items exist. */
    @Builder.Default
    int fallbackOnSessionExhaustionMinItems = 1;

    @Builder.Default
    long pageDelayMs = 100;

    @Builder.Default
    long pageDelayJitterMs = 200;

    @Builder.Default
    long emptyRetryDelayMs = 500;

    @Builder.Default
    long errorRetryDelayMs = 500;

    @Builder.Default
    long rotationDelayMs = 200;

    @Builder.Default
    long delayJitterMs = 300;

    public static PaginationPolicy defaults() {
        return PaginationPolicy.builder().build();
    }
}
