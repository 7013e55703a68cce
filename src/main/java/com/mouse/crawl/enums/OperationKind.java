package com.mouse.crawl.enums;

/**
 * Upstream GraphQL operations the crawler knows how to issue.
 * Search is fingerprint-blocked for direct requests, so it goes through passive capture.
 */
public enum OperationKind {

    USER_BY_SCREEN_NAME("UserByScreenName", "xmU6X_CKVnQ5lSrCbAmJsg", false),
    USER_FEED("UserTweets", "V7H0Ap3_Hh2FyS75OCDO3Q", false),
    SEARCH_TIMELINE("SearchTimeline", "UN1i3zUiCWa-6r-Uaho4fw", true),
    ITEM_DETAIL("TweetDetail", "_8aYOgEDz35BrBcBal1-_w", false);

    private final String operationName;
    private final String defaultQueryId;
    private final boolean passiveCapture;

    OperationKind(String operationName, String defaultQueryId, boolean passiveCapture) {
        this.operationName = operationName;
        this.defaultQueryId = defaultQueryId;
        this.passiveCapture = passiveCapture;
    }

    public String getOperationName() {
        return operationName;
    }

    public String getDefaultQueryId() {
        return defaultQueryId;
    }

    public boolean requiresPassiveCapture() {
        return passiveCapture;
    }
}
