package com.mouse.crawl.enums;

public enum FetchMode {
    PRIMARY,
    FALLBACK
}
