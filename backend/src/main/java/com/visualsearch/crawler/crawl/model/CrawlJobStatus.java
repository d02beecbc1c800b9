package com.visualsearch.crawler.crawl.model;

import java.util.Locale;

public enum CrawlJobStatus {
    QUEUED,
    RUNNING,
    PAUSED,
    SUCCEEDED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }

    public static CrawlJobStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return CrawlJobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
