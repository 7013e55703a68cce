package com.mouse.crawl.exception;

import com.mouse.crawl.enums.ErrorKind;
import lombok.Getter;

/**
 * Typed failure raised by the dispatch layer and consumed by the pagination engine.
 */
@Getter
public class CrawlException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean retryable;
    private final Integer statusCode;
    private final String operation;

    public CrawlException(ErrorKind kind, String message) {
        this(kind, message, kind.isRetryableByDefault(), null, null, null);
    }

    public CrawlException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, kind.isRetryableByDefault(), null, null, cause);
    }

    public CrawlException(ErrorKind kind, String message, boolean retryable,
                          Integer statusCode, String operation, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
        this.statusCode = statusCode;
        this.operation = operation;
    }

    /** Maps a non-2xx upstream status onto the error taxonomy. */
    public static CrawlException fromStatus(int status, String operation) {
        if (status == 401 || status == 403) {
            return new CrawlException(ErrorKind.AUTH,
                    "Authentication failed (" + status + ") for " + operation, false, status, operation, null);
        }
        if (status == 404) {
            return new CrawlException(ErrorKind.NOT_FOUND,
                    "Resource not found (" + status + ") for " + operation, false, status, operation, null);
        }
        if (status == 429) {
            return new CrawlException(ErrorKind.RATE_LIMIT,
                    "Rate limit exceeded (" + status + ") for " + operation, true, status, operation, null);
        }
        boolean serverSide = status >= 500 && status < 600;
        return new CrawlException(ErrorKind.UPSTREAM,
                (serverSide ? "Upstream server error (" : "Upstream rejected request (") + status + ") for " + operation,
                serverSide, status, operation, null);
    }

    public static CrawlException cancelled(String where) {
        return new CrawlException(ErrorKind.CANCELLED, "Cancelled while " + where);
    }
}
