package com.mouse.crawl.enums;

public enum ErrorKind {

    /**
     * Connection reset, refused, DNS failure
     */
    NETWORK(true),

    TIMEOUT(true),

    /**
     * 429 or an explicit quota-exhausted signal
     */
    RATE_LIMIT(true),

    /**
     * 401/403 or an invalidated session
     */
    AUTH(false),

    NOT_FOUND(false),

    BROWSER_CRASHED(true),

    /**
     * Upstream payload no longer has the expected shape
     */
    DATA_EXTRACTION(false),

    CONFIG(false),

    /**
     * Any other HTTP failure; retryability is decided per status
     */
    UPSTREAM(false),

    CANCELLED(false),

    UNKNOWN(false);

    private final boolean retryableByDefault;

    ErrorKind(boolean retryableByDefault) {
        this.retryableByDefault = retryableByDefault;
    }

    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }

    /** Kinds that send the engine straight to a session rotation. */
    public boolean triggersRotation() {
        return this == NETWORK || this == TIMEOUT || this == RATE_LIMIT || this == AUTH;
    }

    /** Kinds surfaced to the caller as a target-level failure without any recovery attempt. */
    public boolean isTerminal() {
        return this == NOT_FOUND || this == DATA_EXTRACTION || this == CONFIG || this == CANCELLED;
    }
}
