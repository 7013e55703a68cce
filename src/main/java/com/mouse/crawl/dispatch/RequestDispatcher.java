package com.mouse.crawl.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.crawl.capture.PassiveCaptureClient;
import com.mouse.crawl.capture.PassiveCaptureProvider;
import com.mouse.crawl.config.CrawlerConfig;
import com.mouse.crawl.enums.ErrorKind;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.manager.ProxyPool;
import com.mouse.crawl.model.Identity;
import com.mouse.crawl.model.Proxy;
import com.mouse.crawl.model.Session;
import com.mouse.crawl.ratelimit.RateLimiter;
import com.mouse.crawl.utils.CancellableSleeper;
import com.mouse.crawl.utils.ErrorClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.function.BooleanSupplier;

/**
 * Executes one upstream operation as a given session and returns the raw payload.
 * Passive-capture operations go through the session's browser; everything else is a direct
 * request with bounded exponential backoff.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestDispatcher {

    private final DirectTransport transport;
    private final PassiveCaptureProvider captureProvider;
    private final ProxyPool proxyPool;
    private final RateLimiter rateLimiter;
    private final CancellableSleeper sleeper;
    private final CrawlerConfig config;
    private final ObjectMapper objectMapper;

    /**
     * @param proxyEnabled when false the call uses direct egress even if proxies are loaded
     * @throws CrawlException classified failure; for direct operations the last attempt's error
     */
    public JsonNode dispatch(UpstreamRequest request, Session session, boolean proxyEnabled, BooleanSupplier shouldStop) {
        if (shouldStop.getAsBoolean()) {
            throw CrawlException.cancelled("dispatching " + request.operation().getOperationName());
        }
        if (request.operation().requiresPassiveCapture()) {
            return dispatchPassive(request, session, proxyEnabled, shouldStop);
        }
        return dispatchDirect(request, session, proxyEnabled, shouldStop);
    }

    /** Tears down the session's capture browser after a crash. */
    public void restartCapture(String sessionId) {
        captureProvider.restart(sessionId);
    }

    private JsonNode dispatchPassive(UpstreamRequest request, Session session, boolean proxyEnabled,
                                     BooleanSupplier shouldStop) {
        String operation = request.operation().getOperationName();
        String query = request.rawQuery();
        if (query == null || query.isBlank()) {
            throw new CrawlException(ErrorKind.CONFIG, operation + " needs a rawQuery variable");
        }

        Identity identity = new Identity(session, proxyEnabled ? proxyPool.resolveFor(session.getId()) : null);
        PassiveCaptureClient client = captureProvider.clientFor(identity, request.operation());
        try {
            if (request.cursor() == null || !query.equals(client.currentQuery())) {
                return client.startNewQuery(query, shouldStop);
            }
            return client.continueQuery(shouldStop);
        } catch (RuntimeException e) {
            CrawlException failure = ErrorClassifier.toCrawlException(e, operation);
            log.warn("Passive capture failed for {} as {}: [{}] {}", operation, session.getId(),
                    failure.getKind(), failure.getMessage());
            if (identity.hasProxy() && ErrorClassifier.isProxyFailure(e, true)) {
                proxyPool.markBad(identity.proxyId(), failure.getMessage());
            }
            throw failure;
        }
    }

    private JsonNode dispatchDirect(UpstreamRequest request, Session session, boolean proxyEnabled,
                                    BooleanSupplier shouldStop) {
        String operation = request.operation().getOperationName();

        if (!rateLimiter.waitForSlot(operation, config.getAdmissionMaxRequests(), config.getAdmissionWindowMs(),
                config.getAdmissionWaitTimeoutMs(), shouldStop)) {
            if (shouldStop.getAsBoolean()) {
                throw CrawlException.cancelled("waiting for an admission slot");
            }
            log.warn("No admission slot for {} within {}ms, proceeding anyway", operation, config.getAdmissionWaitTimeoutMs());
        }
        if (!sleeper.sleep(rateLimiter.getDelay(operation), shouldStop)) {
            throw CrawlException.cancelled("throttling " + operation);
        }

        int maxAttempts = Math.max(1, config.getDispatchMaxAttempts());
        CrawlException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Proxy proxy = proxyEnabled ? proxyPool.resolveFor(session.getId()) : null;
            try {
                JsonNode payload = sendOnce(request, session, proxy, shouldStop);
                if (proxy != null) {
                    proxyPool.markGood(proxy.getId());
                }
                return payload;
            } catch (IOException e) {
                lastError = ErrorClassifier.toCrawlException(e, operation);
                if (ErrorClassifier.isProxyFailure(e, proxy != null) && proxy != null) {
                    proxyPool.markBad(proxy.getId(), e.getClass().getSimpleName() + ": " + e.getMessage());
                }
            } catch (CrawlException e) {
                if (e.getKind() == ErrorKind.CANCELLED) {
                    throw e;
                }
                lastError = e;
            }

            if (!lastError.isRetryable() || attempt == maxAttempts) {
                break;
            }
            long delay = config.getDispatchInitialBackoffMs() * (long) Math.pow(config.getDispatchBackoffFactor(), attempt - 1);
            log.info("{} failed (attempt {}/{}): [{}] {}. Retrying in {}ms",
                    operation, attempt, maxAttempts, lastError.getKind(), lastError.getMessage(), delay);
            if (!sleeper.sleep(delay, shouldStop)) {
                throw CrawlException.cancelled("backing off " + operation);
            }
        }

        log.warn("{} failed for session {}: [{}] {}", operation, session.getId(), lastError.getKind(), lastError.getMessage());
        throw lastError;
    }

    private JsonNode sendOnce(UpstreamRequest request, Session session, Proxy proxy, BooleanSupplier shouldStop)
            throws IOException {
        String operation = request.operation().getOperationName();
        DirectResponse response = transport.send(request, session, proxy, shouldStop);
        rateLimiter.updateFromHeaders(operation, response.rateLimitRemaining(), response.rateLimitReset(),
                response.rateLimitLimit());

        if (!response.isOk()) {
            throw CrawlException.fromStatus(response.statusCode(), operation);
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new CrawlException(ErrorKind.DATA_EXTRACTION, operation + " returned a non-JSON body",
                    false, response.statusCode(), operation, e);
        }
    }
}
