package com.mouse.crawl.credential;

import com.mouse.crawl.model.CookieEntry;

import java.util.List;

public record LoadedCredentials(List<CookieEntry> cookies, String identityLabel) {

    public LoadedCredentials {
        cookies = List.copyOf(cookies);
    }
}
