package com.mouse.crawl.support;

import com.mouse.crawl.config.CrawlerConfig;
import com.mouse.crawl.model.CookieEntry;
import com.mouse.crawl.model.CrawlItem;
import com.mouse.crawl.model.Session;

import java.time.Instant;
import java.util.List;

public final class Fixtures {

    private Fixtures() {
    }

    public static CrawlerConfig config() {
        CrawlerConfig config = new CrawlerConfig();
        config.setSessionMaxErrorCount(3);
        config.setSessionMaxConsecutiveFailures(2);
        config.setProxyMaxErrorCount(3);
        config.setProxyMaxConsecutiveFailures(2);
        config.setAdmissionMaxRequests(50);
        config.setAdmissionWindowMs(60_000);
        config.setAdmissionWaitTimeoutMs(60_000);
        config.setDispatchMaxAttempts(3);
        config.setDispatchInitialBackoffMs(1500);
        config.setDispatchBackoffFactor(2);
        config.setRequestTimeoutMs(5_000);
        config.setPageSize(20);
        config.setBearerToken("test-bearer");
        config.setUserAgent("test-agent");
        config.setCaptureWaitTimeoutMs(15_000);
        config.setCapturePollIntervalMs(500);
        return config;
    }

    public static Session session(String id) {
        return new Session(id, List.of(
                CookieEntry.builder().name("auth_token").value("token-" + id).build(),
                CookieEntry.builder().name("ct0").value("csrf-" + id).build()),
                id + "-user", "test");
    }

    public static CrawlItem item(String id, Instant createdAt) {
        return CrawlItem.builder().id(id).createdAt(createdAt).authorHandle("author").text("text " + id).build();
    }
}
