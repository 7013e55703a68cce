package com.mouse.crawl.model;

/**
 * Session plus the proxy it is bound to for one upstream call. Proxy is null in direct-egress mode.
 */
public record Identity(Session session, Proxy proxy) {

    public String sessionId() {
        return session != null ? session.getId() : null;
    }

    public String proxyId() {
        return proxy != null ? proxy.getId() : null;
    }

    public boolean hasProxy() {
        return proxy != null;
    }
}
