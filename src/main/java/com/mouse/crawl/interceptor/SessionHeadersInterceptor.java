package com.mouse.crawl.interceptor;

import com.mouse.crawl.model.Session;
import lombok.RequiredArgsConstructor;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

/**
 * Applies one session's credentials to every request of its client.
 */
@RequiredArgsConstructor
public class SessionHeadersInterceptor implements Interceptor {

    static final String CSRF_COOKIE = "ct0";

    private final Session session;
    private final String bearerToken;
    private final String userAgent;

    @Override
    public Response intercept(Interceptor.Chain chain) throws IOException {
        Request original = chain.request();

        Request.Builder builder = original.newBuilder()
                .header("User-Agent", userAgent != null ? userAgent : "Mozilla/5.0")
                .header("Cookie", session.cookieHeader())
                .header("x-csrf-token", session.cookieValue(CSRF_COOKIE).orElse(""))
                .header("Accept", "*/*")
                .header("Content-Type", "application/json")
                .header("x-twitter-active-user", "yes")
                .header("x-twitter-auth-type", "OAuth2Session");

        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", bearerToken.startsWith("Bearer ") ? bearerToken : "Bearer " + bearerToken);
        }

        return chain.proceed(builder.build());
    }
}
