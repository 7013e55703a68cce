package com.mouse.crawl.capture;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.crawl.config.CrawlerConfig;
import com.mouse.crawl.enums.OperationKind;
import com.mouse.crawl.model.Identity;
import com.mouse.crawl.utils.CancellableSleeper;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One capture browser per session. A client is replaced when its session's proxy binding changes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PassiveCaptureProvider {

    private record Entry(String proxyId, PassiveCaptureClient client) {
    }

    private final CrawlerConfig config;
    private final ObjectMapper objectMapper;
    private final CancellableSleeper sleeper;
    private final Clock clock;

    private final Map<String, Entry> clients = new ConcurrentHashMap<>();

    public PassiveCaptureClient clientFor(Identity identity, OperationKind operation) {
        Entry entry = clients.compute(identity.sessionId(), (sessionId, current) -> {
            if (current != null && Objects.equals(current.proxyId(), identity.proxyId())) {
                return current;
            }
            if (current != null) {
                log.info("Proxy for session {} changed ({} -> {}), replacing capture browser",
                        sessionId, current.proxyId(), identity.proxyId());
                current.client().close();
            }
            return new Entry(identity.proxyId(), createClient(identity, operation));
        });
        return entry.client();
    }

    protected PassiveCaptureClient createClient(Identity identity, OperationKind operation) {
        return new PlaywrightPassiveCaptureClient(identity, operation.getOperationName(), config, objectMapper, sleeper, clock);
    }

    public void restart(String sessionId) {
        Entry entry = clients.get(sessionId);
        if (entry != null) {
            entry.client().restart();
        }
    }

    @PreDestroy
    public void closeAll() {
        clients.forEach((sessionId, entry) -> {
            log.info("Closing capture browser for session {}", sessionId);
            entry.client().close();
        });
        clients.clear();
    }
}
