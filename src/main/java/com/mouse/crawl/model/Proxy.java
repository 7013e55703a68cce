package com.mouse.crawl.model;

import lombok.Getter;

/**
 * Outbound egress point. Identity is host:port.
 */
@Getter
public class Proxy extends HealthTracked {

    private final String id;
    private final String host;
    private final int port;
    private final String username;
    private final String password;

    public Proxy(String host, int port, String username, String password) {
        this.id = host + ":" + port;
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    @Override
    public String toString() {
        return "Proxy{" + id + ", errors=" + getErrorCount() + ", retired=" + isRetired() + "}";
    }
}
