package com.mouse.crawl.capture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.SameSiteAttribute;
import com.microsoft.playwright.options.ViewportSize;
import com.microsoft.playwright.options.WaitUntilState;
import com.mouse.crawl.config.CrawlerConfig;
import com.mouse.crawl.exception.CrawlException;
import com.mouse.crawl.model.CookieEntry;
import com.mouse.crawl.model.Identity;
import com.mouse.crawl.model.Proxy;
import com.mouse.crawl.utils.CancellableSleeper;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BooleanSupplier;

/**
 * Chromium page logged in as one session. Search results are read from the page's own
 * GraphQL responses rather than requested directly.
 */
@Slf4j
public class PlaywrightPassiveCaptureClient extends AbstractPassiveCaptureClient {

    private final Identity identity;
    private final CrawlerConfig config;
    private final ObjectMapper objectMapper;

    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;
    private Page page;

    public PlaywrightPassiveCaptureClient(Identity identity, String operationName, CrawlerConfig config,
                                          ObjectMapper objectMapper, CancellableSleeper sleeper, Clock clock) {
        super(operationName, config.getCaptureWaitTimeoutMs(), config.getCapturePollIntervalMs(), sleeper, clock);
        this.identity = identity;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void start() {
        log.info("Launching capture browser for session {} via {}", identity.sessionId(),
                identity.hasProxy() ? identity.proxyId() : "direct");
        playwright = Playwright.create();

        List<String> args = new ArrayList<>(config.getBrowserFlags());
        BrowserType.LaunchOptions launchOptions = new BrowserType.LaunchOptions()
                .setHeadless(config.isCaptureHeadless())
                .setTimeout(120_000)
                .setArgs(args);
        Proxy proxy = identity.proxy();
        if (proxy != null) {
            com.microsoft.playwright.options.Proxy browserProxy =
                    new com.microsoft.playwright.options.Proxy("http://" + proxy.getHost() + ":" + proxy.getPort());
            if (proxy.hasCredentials()) {
                browserProxy.setUsername(proxy.getUsername()).setPassword(proxy.getPassword());
            }
            launchOptions.setProxy(browserProxy);
        }
        browser = playwright.chromium().launch(launchOptions);

        context = browser.newContext(new Browser.NewContextOptions()
                .setUserAgent(config.getUserAgent())
                .setViewportSize(new ViewportSize(1366, 900))
                .setLocale("en-US"));
        context.addCookies(toBrowserCookies(identity.session().getCredentialMaterial()));

        page = context.newPage();
        attachNetworkTap(page);
    }

    private void attachNetworkTap(Page target) {
        String marker = "/" + operationName;
        target.onResponse(resp -> {
            if (!resp.url().contains(marker)) {
                return;
            }
            int status = resp.status();
            if (status == 200) {
                readPayload(resp);
            } else if (status >= 400) {
                log.warn("Captured {} with status {}", operationName, status);
                onCaptureFailed(CrawlException.fromStatus(status, operationName));
            }
        });
    }

    private void readPayload(Response resp) {
        try {
            onCaptured(objectMapper.readTree(resp.text()));
        } catch (JsonProcessingException e) {
            log.warn("Unparseable {} payload: {}", operationName, e.getOriginalMessage());
        } catch (PlaywrightException e) {
            log.debug("Response body for {} no longer available: {}", operationName, e.getMessage());
        }
    }

    @Override
    protected void navigateToQuery(String query) {
        String url = config.getCaptureSiteUrl() + "/search?q="
                + URLEncoder.encode(query, StandardCharsets.UTF_8) + "&src=typed_query&f=live";
        page.navigate(url, new Page.NavigateOptions()
                .setTimeout(config.getCaptureWaitTimeoutMs() * 2)
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
    }

    @Override
    protected void triggerLoadMore() {
        page.mouse().wheel(0, 4000);
        page.evaluate("() => window.scrollTo(0, document.body.scrollHeight)");
    }

    /** Playwright only fires listeners while the caller is inside a Playwright call. */
    @Override
    protected boolean pause(long millis, BooleanSupplier shouldStop) {
        if (shouldStop != null && shouldStop.getAsBoolean()) {
            return false;
        }
        page.waitForTimeout(millis);
        return true;
    }

    @Override
    protected void shutdown() {
        try {
            if (context != null) {
                context.close();
            }
            if (browser != null) {
                browser.close();
            }
        } finally {
            if (playwright != null) {
                playwright.close();
            }
            page = null;
            context = null;
            browser = null;
            playwright = null;
        }
    }

    static List<Cookie> toBrowserCookies(List<CookieEntry> entries) {
        List<Cookie> cookies = new ArrayList<>();
        for (CookieEntry entry : entries) {
            Cookie cookie = new Cookie(entry.getName(), entry.getValue())
                    .setDomain(entry.getDomain() != null ? entry.getDomain() : ".x.com")
                    .setPath(entry.getPath() != null ? entry.getPath() : "/");
            if (entry.getExpires() != null && entry.getExpires() > 0) {
                cookie.setExpires(entry.getExpires());
            }
            if (entry.getHttpOnly() != null) {
                cookie.setHttpOnly(entry.getHttpOnly());
            }
            if (entry.getSecure() != null) {
                cookie.setSecure(entry.getSecure());
            }
            SameSiteAttribute sameSite = sameSite(entry.getSameSite());
            if (sameSite != null) {
                cookie.setSameSite(sameSite);
            }
            cookies.add(cookie);
        }
        return cookies;
    }

    private static SameSiteAttribute sameSite(String value) {
        if (value == null) {
            return null;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "strict":
                return SameSiteAttribute.STRICT;
            case "lax":
                return SameSiteAttribute.LAX;
            case "none":
            case "no_restriction":
                return SameSiteAttribute.NONE;
            default:
                return null;
        }
    }
}
