package com.mouse.crawl.model;

import lombok.Getter;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One authenticated identity: a cookie set loaded from a single credential source.
 */
@Getter
public class Session extends HealthTracked {

    private final String id;
    private final List<CookieEntry> credentialMaterial;
    private final String displayName;
    private final String source;

    public Session(String id, List<CookieEntry> credentialMaterial, String displayName, String source) {
        this.id = id;
        this.credentialMaterial = List.copyOf(credentialMaterial);
        this.displayName = displayName;
        this.source = source;
    }

    public String cookieHeader() {
        return credentialMaterial.stream()
                .map(c -> c.getName() + "=" + c.getValue())
                .collect(Collectors.joining("; "));
    }

    public Optional<String> cookieValue(String name) {
        return credentialMaterial.stream()
                .filter(c -> name.equals(c.getName()))
                .map(CookieEntry::getValue)
                .findFirst();
    }

    @Override
    public String toString() {
        return "Session{" + id + ", errors=" + getErrorCount() + ", usage=" + getUsageCount()
                + ", retired=" + isRetired() + "}";
    }
}
