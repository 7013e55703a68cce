package com.mouse.crawl.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.crawl.config.CrawlerConfig;
import com.mouse.crawl.enums.OperationKind;
import com.mouse.crawl.exception.CrawlConfigurationException;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.interceptor.HttpTimingInterceptor;
import com.mouse.crawl.interceptor.SessionHeadersInterceptor;
import com.mouse.crawl.model.Proxy;
import com.mouse.crawl.model.Session;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * GraphQL GET requests over OkHttp. One client per session/proxy pair, all sharing a connection pool.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OkHttpDirectTransport implements DirectTransport {

    static final String FEATURES_RESOURCE = "upstream/features.json";
    static final long STOP_POLL_MS = 200;

    private final CrawlerConfig config;
    private final ObjectMapper objectMapper;

    private final Map<String, OkHttpClient> clients = new ConcurrentHashMap<>();
    private final Map<OperationKind, String> featuresByOperation = new EnumMap<>(OperationKind.class);
    private OkHttpClient baseClient;

    @PostConstruct
    void init() {
        baseClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .readTimeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .callTimeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .retryOnConnectionFailure(false)
                .build();
        loadFeatures();
    }

    private void loadFeatures() {
        ClassPathResource resource = new ClassPathResource(FEATURES_RESOURCE);
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            for (OperationKind kind : OperationKind.values()) {
                JsonNode node = root.has(kind.getOperationName()) ? root.get(kind.getOperationName()) : root.path("default");
                featuresByOperation.put(kind, objectMapper.writeValueAsString(node.isMissingNode() ? objectMapper.createObjectNode() : node));
            }
            log.info("Loaded feature flags for {} operations", featuresByOperation.size());
        } catch (IOException e) {
            throw new CrawlConfigurationException("Cannot load " + FEATURES_RESOURCE, e);
        }
    }

    @Override
    public DirectResponse send(UpstreamRequest request, Session session, Proxy proxy, BooleanSupplier shouldStop)
            throws IOException {
        OperationKind op = request.operation();
        HttpUrl url = buildUrl(request);

        Request httpRequest = new Request.Builder().url(url).get().build();
        log.debug("{} as {} via {} cursor={}", op.getOperationName(), session.getId(),
                proxy != null ? proxy.getId() : "direct", request.cursor());

        Call call = clientFor(session, proxy).newCall(httpRequest);
        CompletableFuture<DirectResponse> result = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                result.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call answered, Response response) {
                try (response) {
                    result.complete(toDirectResponse(response));
                } catch (IOException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        return await(call, result, op.getOperationName(), shouldStop);
    }

    /** Polls the stop flag while the call is in flight; a stop cancels the call. */
    private DirectResponse await(Call call, CompletableFuture<DirectResponse> result, String operation,
                                 BooleanSupplier shouldStop) throws IOException {
        while (true) {
            if (shouldStop.getAsBoolean()) {
                call.cancel();
                throw CrawlException.cancelled("calling " + operation);
            }
            try {
                return result.get(STOP_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // still in flight
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                call.cancel();
                throw CrawlException.cancelled("calling " + operation);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof IOException) {
                    throw (IOException) cause;
                }
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IOException(operation + " failed", cause);
            }
        }
    }

    private static DirectResponse toDirectResponse(Response response) throws IOException {
        ResponseBody body = response.body();
        String payload = body != null ? body.string() : "";
        return new DirectResponse(
                response.code(),
                payload,
                parseInt(response.header("x-rate-limit-remaining")),
                parseLong(response.header("x-rate-limit-reset")),
                parseInt(response.header("x-rate-limit-limit")));
    }

    HttpUrl buildUrl(UpstreamRequest request) throws JsonProcessingException {
        OperationKind op = request.operation();
        HttpUrl base = HttpUrl.get(config.getGraphqlBaseUrl());
        return base.newBuilder()
                .addPathSegment(op.getDefaultQueryId())
                .addPathSegment(op.getOperationName())
                .addQueryParameter("variables", objectMapper.writeValueAsString(request.effectiveVariables()))
                .addQueryParameter("features", featuresByOperation.getOrDefault(op, "{}"))
                .build();
    }

    private OkHttpClient clientFor(Session session, Proxy proxy) {
        String key = session.getId() + "|" + (proxy != null ? proxy.getId() : "direct");
        return clients.computeIfAbsent(key, k -> buildClient(session, proxy));
    }

    private OkHttpClient buildClient(Session session, Proxy proxy) {
        OkHttpClient.Builder builder = baseClient.newBuilder()
                .addInterceptor(new SessionHeadersInterceptor(session, config.getBearerToken(), config.getUserAgent()))
                .addInterceptor(new HttpTimingInterceptor(session.getId()));

        if (proxy != null) {
            builder.proxy(new java.net.Proxy(java.net.Proxy.Type.HTTP,
                    InetSocketAddress.createUnresolved(proxy.getHost(), proxy.getPort())));
            if (proxy.hasCredentials()) {
                String credential = Credentials.basic(proxy.getUsername(), proxy.getPassword());
                builder.proxyAuthenticator((route, response) -> {
                    if (response.request().header("Proxy-Authorization") != null) {
                        return null;
                    }
                    return response.request().newBuilder().header("Proxy-Authorization", credential).build();
                });
            }
        }
        log.info("Created HTTP client for session {} via {}", session.getId(), proxy != null ? proxy.getId() : "direct");
        return builder.build();
    }

    @PreDestroy
    void shutdown() {
        clients.clear();
        if (baseClient != null) {
            baseClient.dispatcher().executorService().shutdown();
            baseClient.connectionPool().evictAll();
        }
    }

    private static Integer parseInt(String value) {
        try {
            return value == null ? null : Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long parseLong(String value) {
        try {
            return value == null ? null : Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
