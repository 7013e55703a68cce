package com.mouse.crawl.interceptor;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Request timing at debug level; failures at warn.
 */
@Slf4j
public class HttpTimingInterceptor implements Interceptor {

    private final String label;

    public HttpTimingInterceptor(String label) {
        this.label = label;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        log.debug("[{}] → {} {}", label, request.method(), request.url().encodedPath());

        long startNs = System.nanoTime();
        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.warn("[{}] ← FAILED after {}ms: {}", label, totalMs, e.getMessage());
            throw e;
        }

        long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        log.debug("[{}] ← {} {} | {}ms | remaining={}",
                label,
                response.code(),
                request.url().encodedPath(),
                totalMs,
                response.header("x-rate-limit-remaining", "-"));
        return response;
    }
}
