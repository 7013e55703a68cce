package com.mouse.crawl.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.exception.CrawlException;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;

/**
 * Maps arbitrary failures onto {@link ErrorKind}.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static CrawlException toCrawlException(Throwable error, String operation) {
        if (error instanceof CrawlException crawlException) {
            return crawlException;
        }
        ErrorKind kind = classify(error);
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new CrawlException(kind, message, kind.isRetryableByDefault(), null, operation, error);
    }

    public static ErrorKind classify(Throwable error) {
        if (error == null) {
            return ErrorKind.UNKNOWN;
        }
        if (error instanceof CrawlException crawlException) {
            return crawlException.getKind();
        }
        if (error instanceof SocketTimeoutException || error instanceof TimeoutError) {
            return ErrorKind.TIMEOUT;
        }
        if (error instanceof ConnectException || error instanceof UnknownHostException
                || error instanceof NoRouteToHostException || error instanceof SocketException) {
            return ErrorKind.NETWORK;
        }
        if (error instanceof InterruptedIOException) {
            // OkHttp call timeouts surface as a bare InterruptedIOException("timeout")
            return ErrorKind.TIMEOUT;
        }
        if (error instanceof JsonProcessingException) {
            return ErrorKind.DATA_EXTRACTION;
        }
        if (error instanceof PlaywrightException) {
            return classifyMessage(error.getMessage(), ErrorKind.BROWSER_CRASHED);
        }
        ErrorKind byMessage = classifyMessage(error.getMessage(), ErrorKind.UNKNOWN);
        if (byMessage == ErrorKind.UNKNOWN && error.getCause() != null && error.getCause() != error) {
            return classify(error.getCause());
        }
        return byMessage;
    }

    /** Proxy-attributable failures: a timeout while a proxy is bound, or a refused connection. */
    public static boolean isProxyFailure(Throwable error, boolean proxyBound) {
        if (error instanceof ConnectException) {
            return true;
        }
        String msg = lower(error == null ? null : error.getMessage());
        if (msg.contains("connection refused") || msg.contains("econnrefused")) {
            return true;
        }
        return proxyBound && classify(error) == ErrorKind.TIMEOUT;
    }

    static ErrorKind classifyMessage(String message, ErrorKind otherwise) {
        String msg = lower(message);
        if (msg.isEmpty()) {
            return otherwise;
        }
        if (msg.contains("429") || msg.contains("too many requests") || msg.contains("rate limit")) {
            return ErrorKind.RATE_LIMIT;
        }
        if (msg.contains("401") || msg.contains("403") || msg.contains("unauthorized")
                || msg.contains("forbidden") || msg.contains("could not authenticate")) {
            return ErrorKind.AUTH;
        }
        if (msg.contains("timeout") || msg.contains("timed out") || msg.contains("etimedout")) {
            return ErrorKind.TIMEOUT;
        }
        if (msg.contains("econnreset") || msg.contains("econnrefused") || msg.contains("enotfound")
                || msg.contains("connection reset") || msg.contains("connection refused")
                || msg.contains("net::err_") || msg.contains("socket hang up")) {
            return ErrorKind.NETWORK;
        }
        if (msg.contains("target closed") || msg.contains("browser has been closed")
                || msg.contains("channel closed") || msg.contains("object doesn't exist")
                || msg.contains("page crashed")) {
            return ErrorKind.BROWSER_CRASHED;
        }
        return otherwise;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
