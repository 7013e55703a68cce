package com.mouse.crawl.dispatch;

/**
 * Raw transport result. Quota header fields are null when the upstream omitted them.
 */
public record DirectResponse(int statusCode, String body, Integer rateLimitRemaining, Long rateLimitReset,
                             Integer rateLimitLimit) {

    public boolean isOk() {
        return statusCode == 200;
    }
}
