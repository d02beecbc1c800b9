package com.visualsearch.crawler.crawl.model;

import java.util.Locale;

public enum CrawlerType {
    GENERIC("generic"),
    BROWSER_RENDERED("browser");

    private final String value;

    CrawlerType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Unknown or missing types resolve to {@link #GENERIC}.
     */
    public static CrawlerType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return GENERIC;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CrawlerType type : values()) {
            if (type.value.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        if (normalized.equals("browserrendered")) {
            return BROWSER_RENDERED;
        }
        return GENERIC;
    }
}
