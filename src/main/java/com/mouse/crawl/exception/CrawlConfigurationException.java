package com.mouse.crawl.exception;

import com.mouse.crawl.enums.ErrorKind;

/**
 * Invalid crawl request, detected before any network call is made.
 */
public class CrawlConfigurationException extends CrawlException {

    public CrawlConfigurationException(String message) {
        super(ErrorKind.CONFIG, message);
    }

    public CrawlConfigurationException(String message, Throwable e) {
        super(ErrorKind.CONFIG, message, e);
    }
}
