package com.mouse.crawl.credential;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.crawl.exception.CrawlConfigurationException;
import com.mouse.crawl.model.CookieEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accepts either a bare cookie array (browser export) or {@code {"username": "...", "cookies": [...]}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonCookieCredentialSource implements CredentialSource {

    static final String AUTH_COOKIE = "auth_token";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public LoadedCredentials loadCredentials(Path path) {
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new CrawlConfigurationException("Unreadable credential file " + path.getFileName() + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new CrawlConfigurationException("Empty credential file " + path.getFileName());
        }

        JsonNode cookieNode;
        String username = null;
        if (root.isArray()) {
            cookieNode = root;
        } else if (root.isObject() && root.path("cookies").isArray()) {
            cookieNode = root.get("cookies");
            username = root.path("username").asText(null);
        } else {
            throw new CrawlConfigurationException("Credential file " + path.getFileName()
                    + " must be a cookie array or an object with a cookies array");
        }

        List<CookieEntry> cookies = objectMapper.convertValue(cookieNode, new TypeReference<List<CookieEntry>>() {});
        for (CookieEntry cookie : cookies) {
            if (isBlank(cookie.getName()) || cookie.getValue() == null) {
                throw new CrawlConfigurationException("Cookie without name or value in " + path.getFileName());
            }
        }

        double nowSeconds = clock.millis() / 1000.0;
        List<CookieEntry> live = cookies.stream()
                .filter(c -> c.getExpires() == null || c.getExpires() <= 0 || c.getExpires() > nowSeconds)
                .collect(Collectors.toList());
        if (live.size() < cookies.size()) {
            log.info("Filtered {} expired cookie(s) from {}", cookies.size() - live.size(), path.getFileName());
        }

        if (live.stream().noneMatch(c -> AUTH_COOKIE.equals(c.getName()) && !c.getValue().isBlank())) {
            throw new CrawlConfigurationException("Credential file " + path.getFileName() + " has no valid " + AUTH_COOKIE + " cookie");
        }

        return new LoadedCredentials(live, isBlank(username) ? null : username);
    }

    @Override
    public String fileGlob() {
        return "*.json";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
