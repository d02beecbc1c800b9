package com.visualsearch.crawler.crawl.model;

import java.time.Instant;

public record CrawlJobView(
    long id,
    long providerId,
    String providerName,
    String startUrl,
    String sitemapUrl,
    Integer maxPages,
    CrawlJobStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant pausedAt,
    Instant canceledAt,
    Instant completedAt,
    String leaseOwner,
    Instant leaseExpiresAt,
    String errorMessage,
    int pagesTotal,
    int pagesSucceeded,
    int pagesFailed,
    int productsExtracted
) {
}
