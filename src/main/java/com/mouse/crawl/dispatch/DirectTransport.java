package com.mouse.crawl.dispatch;

import com.mouse.crawl.model.Proxy;
import com.mouse.crawl.model.Session;

import java.io.IOException;
import java.util.function.BooleanSupplier;

public interface DirectTransport {

    /**
     * Sends one request as {@code session}, through {@code proxy} when it is not null.
     * Non-2xx statuses are returned, not thrown.
     *
     * @throws com.mouse.crawl.exception.CrawlException of kind CANCELLED when {@code shouldStop} turns true
     *                                                  while the call is in flight
     */
    DirectResponse send(UpstreamRequest request, Session session, Proxy proxy, BooleanSupplier shouldStop)
            throws IOException;
}
